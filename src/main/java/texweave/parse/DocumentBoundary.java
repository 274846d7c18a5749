// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import texweave.source.SourceText;

/**
 * Splits a flattened project into its preamble and its body.
 */
public final class DocumentBoundary {
    private DocumentBoundary() {
    }

    /**
     * Returns the offset of the {@code \begin{document}} command outside comments, or 0 if there is none, in which
     * case the whole text is body. The preamble occupies everything before the returned offset.
     */
    public static int bodyStart(final SourceText source) {
        final var text = source.text();
        for (int i = 0; i < text.length(); i += 1) {
            final var ch = text.charAt(i);
            if (ch == '%') {
                final var newline = text.indexOf('\n', i);
                if (newline < 0) {
                    break;
                }
                i = newline;
            } else if (ch == '\\') {
                if (text.startsWith(beginDocument, i)) {
                    return i;
                }
                i += 1;
            }
        }
        return 0;
    }

    private static final String beginDocument = "\\begin{document}";
}
