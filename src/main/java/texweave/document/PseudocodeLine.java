// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

import texweave.util.annotation.Nullable;

/**
 * One line of pseudocode.
 *
 * @param depth   The nesting depth, 0 for the outermost block.
 * @param keyword The leading keyword, such as {@code "while"} or {@code "Require:"}, empty for plain statements.
 * @param text    The statement or condition, as TeX source.
 * @param trailer The keyword following the text, such as {@code "do"} or {@code "then"}, empty if none.
 * @param comment The comment attached to the line, if any.
 */
public record PseudocodeLine(int depth, String keyword, String text, String trailer, @Nullable String comment) {
    public static PseudocodeLine of(final int depth, final String keyword, final String text) {
        return new PseudocodeLine(depth, keyword, text, "", null);
    }

    public PseudocodeLine withComment(final @Nullable String comment) {
        return new PseudocodeLine(depth, keyword, text, trailer, comment);
    }
}
