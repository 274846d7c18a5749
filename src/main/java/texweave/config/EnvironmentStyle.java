// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import texweave.document.EnvironmentKind;

/**
 * The behavior descriptor of one environment name.
 *
 * @param kind         How the parser treats the environment.
 * @param cssClass     The class the renderer styles the block with.
 * @param displayLabel The user-visible name, such as {@code "Theorem"}.
 * @param counter      The counter the environment is numbered by; environments sharing a counter share numbers.
 * @param numbering    How the environment is numbered.
 * @param reset        When its counter resets.
 */
public record EnvironmentStyle(
    EnvironmentKind kind,
    String cssClass,
    String displayLabel,
    String counter,
    NumberingScheme numbering,
    ResetScope reset
) {
    public boolean isNumbered() {
        return numbering != NumberingScheme.NONE;
    }

    public CounterRule counterRule() {
        return new CounterRule(numbering, reset);
    }

    public EnvironmentStyle withDisplayLabel(final String displayLabel) {
        return new EnvironmentStyle(kind, cssClass, displayLabel, counter, numbering, reset);
    }

    /**
     * A theorem-like environment with its own counter, numbered per chapter.
     */
    public static EnvironmentStyle theoremLike(final String name, final String cssClass, final String displayLabel) {
        return new EnvironmentStyle(
            EnvironmentKind.THEOREM_LIKE,
            cssClass,
            displayLabel,
            name,
            NumberingScheme.HIERARCHICAL,
            ResetScope.PER_CHAPTER
        );
    }

    /**
     * An unnumbered block of the given kind.
     */
    public static EnvironmentStyle unnumbered(
        final String name,
        final EnvironmentKind kind,
        final String cssClass,
        final String displayLabel
    ) {
        return new EnvironmentStyle(kind, cssClass, displayLabel, name, NumberingScheme.NONE, ResetScope.GLOBAL);
    }

    /**
     * The descriptor of an environment nobody declared.
     */
    public static EnvironmentStyle unknown(final String name) {
        return unnumbered(name, EnvironmentKind.UNKNOWN, "env-unknown", name);
    }

    /**
     * Infers a descriptor from a CSS class alone: the numbered theorem, definition and example classes give
     * theorem-like environments, {@code env-proof} a proof, anything else an unnumbered custom block.
     */
    public static EnvironmentStyle fromCssClass(final String name, final String cssClass, final String displayLabel) {
        return switch (cssClass) {
            case "env-theorem", "env-definition", "env-example" -> theoremLike(name, cssClass, displayLabel);
            case "env-proof" -> unnumbered(name, EnvironmentKind.PROOF, cssClass, displayLabel);
            default -> unnumbered(name, EnvironmentKind.CUSTOM, cssClass, displayLabel);
        };
    }
}
