// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

import java.util.Set;

/**
 * Environment names that switch the lexer into math mode.
 */
public final class MathEnvironments {
    private MathEnvironments() {
    }

    public static boolean isMath(final String name) {
        return names.contains(name);
    }

    /**
     * Returns whether a block of the given environment receives an equation number.
     * <p>
     * Starred forms and {@code displaymath} are unnumbered.
     */
    public static boolean isNumbered(final String name) {
        return isMath(name) && !name.endsWith("*") && !name.equals("displaymath") && !name.equals("math");
    }

    private static final Set<String> names = Set.of(
        "equation", "equation*",
        "align", "align*",
        "gather", "gather*",
        "multline", "multline*",
        "flalign", "flalign*",
        "alignat", "alignat*",
        "eqnarray", "eqnarray*",
        "displaymath",
        "math"
    );
}
