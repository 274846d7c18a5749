// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

import texweave.util.annotation.Nullable;

/**
 * The command family a {@link Node.CrossRef} came from, which decides how the resolved link is displayed.
 */
public enum ReferenceKind {
    /**
     * {@code \ref}: the target's number.
     */
    REF,
    /**
     * {@code \pageref}: there are no pages, so the target's number.
     */
    PAGEREF,
    /**
     * {@code \eqref}: the number in parentheses.
     */
    EQREF,
    /**
     * {@code \cref}, {@code \autoref} and friends: the target's display label followed by its number.
     */
    CREF,
    /**
     * {@code \nameref}: the target's title.
     */
    NAMEREF,
    /**
     * {@code \cite} and friends: a citation marker.
     */
    CITE;

    /**
     * Returns the kind of reference made by command {@code name}, or {@code null} if it makes none.
     */
    public static @Nullable ReferenceKind ofCommand(final String name) {
        return switch (name) {
            case "ref", "vref" -> REF;
            case "pageref" -> PAGEREF;
            case "eqref" -> EQREF;
            case "cref", "Cref", "autoref" -> CREF;
            case "nameref" -> NAMEREF;
            case "cite", "citep", "citet", "citealt", "citealp", "parencite", "textcite", "autocite", "footcite" ->
                CITE;
            default -> null;
        };
    }

    public boolean isCitation() {
        return this == CITE;
    }
}
