// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagram;

/**
 * Renders diagram source to an image. Implementations must be safe to call from several threads at once.
 */
public interface DiagramRenderer {
    /**
     * Renders one diagram.
     *
     * @return The path of the rendered image, relative to the output document.
     * @throws DiagramRenderingException If the diagram cannot be rendered, for whatever reason.
     */
    String render(DiagramRequest request) throws DiagramRenderingException;
}
