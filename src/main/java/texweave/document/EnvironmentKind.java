// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

public enum EnvironmentKind {
    /**
     * Theorems, lemmas, definitions and other numbered statements.
     */
    THEOREM_LIKE,
    PROOF,
    /**
     * {@code itemize}, {@code enumerate} and {@code description}.
     */
    LIST,
    /**
     * A block styled through the environment table, such as a colored box.
     */
    CUSTOM,
    /**
     * An environment nothing is known about, rendered as a plain block.
     */
    UNKNOWN,
}
