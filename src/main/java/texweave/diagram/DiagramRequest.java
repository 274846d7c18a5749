// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagram;

import java.util.List;

/**
 * One diagram to render.
 *
 * @param name        A name unique within the document, usable as a file name.
 * @param environment The diagram environment, such as {@code tikzpicture}.
 * @param source      The complete diagram source, {@code \begin} and {@code \end} included.
 * @param setup       The document's TikZ and PGFPlots preamble declarations, in order.
 */
public record DiagramRequest(String name, String environment, String source, List<String> setup) {
    public DiagramRequest {
        setup = List.copyOf(setup);
    }
}
