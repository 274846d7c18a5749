// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

/**
 * What became of a diagram's rendering.
 */
public sealed interface DiagramRendering {
    /**
     * Not attempted yet; only seen before the rendering stage.
     */
    record Pending() implements DiagramRendering {
    }

    /**
     * Rendered to an image.
     *
     * @param imagePath The path of the rendered image, relative to the output.
     */
    record Rendered(String imagePath) implements DiagramRendering {
    }

    /**
     * Rendering failed or no renderer is available; the raw source is displayed instead.
     */
    record Unavailable(String reason) implements DiagramRendering {
    }
}
