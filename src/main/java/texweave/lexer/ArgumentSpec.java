// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

/**
 * How one argument of a known command or environment is lexed.
 */
public enum ArgumentSpec {
    /**
     * A bracketed {@code [...]} argument that may be absent. Captured as raw text.
     */
    OPTIONAL,
    /**
     * A mandatory argument captured as raw text: a braced group, or a single control sequence or character.
     */
    RAW,
    /**
     * A mandatory braced argument whose contents stay in the token stream, delimited by group tokens, so they can be
     * parsed as ordinary document content. Only trailing arguments may be content arguments.
     */
    CONTENT,
}
