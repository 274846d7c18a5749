// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.numbering;

import java.util.HashMap;
import java.util.Map;
import texweave.config.Configuration;
import texweave.config.CounterRule;
import texweave.config.EnvironmentTable;
import texweave.document.DivisionLevel;

/**
 * Everything the numbering engine needs to know besides the tree itself.
 *
 * @param environments The environment table, deciding which environments are numbered and by which counter.
 * @param counterRules Rules overriding those of the environment table, plus the rules of the built-in counters
 *                     ({@code equation}, {@code figure}, {@code table}, {@code listing}, {@code algorithm},
 *                     {@code footnote}).
 * @param topLevel     The outermost sectioning level below {@code \part}; its divisions take letters in the appendix.
 */
public record NumberingPlan(
    EnvironmentTable environments,
    Map<String, CounterRule> counterRules,
    DivisionLevel topLevel
) {
    public NumberingPlan {
        counterRules = Map.copyOf(counterRules);
    }

    /**
     * Builds the plan of a conversion. Counter rules come, by increasing precedence, from the built-in defaults,
     * from {@code declaredRules} (what the document itself declares with {@code \numberwithin}) and from the
     * configuration.
     */
    public static NumberingPlan of(
        final Configuration configuration,
        final Map<String, CounterRule> declaredRules,
        final EnvironmentTable environments,
        final DivisionLevel topLevel
    ) {
        final var rules = new HashMap<String, CounterRule>();
        for (final var counter : Configuration.builtInCounters) {
            rules.put(counter, configuration.counterRule(counter));
        }
        rules.putAll(declaredRules);
        rules.putAll(configuration.counters());
        return new NumberingPlan(environments, rules, topLevel);
    }

    /**
     * Returns the rule of {@code counter}: the explicit rule if there is one, {@code fallback} otherwise.
     */
    public CounterRule ruleFor(final String counter, final CounterRule fallback) {
        final var rule = counterRules.get(counter);
        return (rule != null) ? rule : fallback;
    }
}
