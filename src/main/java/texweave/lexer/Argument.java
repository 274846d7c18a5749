// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

/**
 * A captured command or environment argument.
 *
 * @param spec         How the argument was lexed.
 * @param text         The raw argument text without its delimiters; empty for an absent optional argument.
 * @param contentStart Offset of the first character of {@code text} in the flattened source.
 * @param contentEnd   Offset just past the last character of {@code text}.
 * @param present      Whether the argument was given; only optional arguments may be absent.
 */
public record Argument(ArgumentSpec spec, String text, int contentStart, int contentEnd, boolean present) {
    static Argument absent(final int offset) {
        return new Argument(ArgumentSpec.OPTIONAL, "", offset, offset, false);
    }
}
