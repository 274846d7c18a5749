// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.lexer;

import java.util.Set;

/**
 * Environment names whose contents are never interpreted, only copied until the exactly matching {@code \end}.
 */
public final class VerbatimEnvironments {
    private VerbatimEnvironments() {
    }

    public static boolean isVerbatim(final String name) {
        return names.contains(name);
    }

    /**
     * Returns whether the environment's contents are a diagram to be rendered by an external tool.
     */
    public static boolean isDiagram(final String name) {
        return name.equals("tikzpicture") || name.equals("tikzcd");
    }

    /**
     * Returns whether the environment's contents are pseudocode, read line by line rather than as TeX.
     */
    public static boolean isPseudocode(final String name) {
        return name.equals("algorithmic") || name.equals("algorithm2e");
    }

    /**
     * Returns whether the environment is dropped entirely.
     */
    public static boolean isDiscarded(final String name) {
        return name.equals("comment");
    }

    private static final Set<String> names = Set.of(
        "verbatim",
        "verbatim*",
        "Verbatim",
        "lstlisting",
        "minted",
        "tikzpicture",
        "tikzcd",
        "algorithmic",
        "algorithm2e",
        "comment"
    );
}
