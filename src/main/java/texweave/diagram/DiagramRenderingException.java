// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagram;

/**
 * Thrown when a diagram cannot be rendered.
 */
public final class DiagramRenderingException extends Exception {
    public DiagramRenderingException(final String message) {
        super(message);
    }

    public DiagramRenderingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
