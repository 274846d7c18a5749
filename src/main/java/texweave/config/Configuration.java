// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The immutable conversion configuration. Loaded once before a conversion and never modified by it.
 *
 * @param metadata       Overrides for the document metadata declared in the preamble.
 * @param tabs           Navigation tabs, in display order.
 * @param environments   Environment descriptors taking precedence over the built-in ones and the document's own.
 * @param counters       Numbering rules of the built-in counters, keyed by counter name.
 * @param mathMacros     Math-macro substitutions handed to the renderer, keyed by command with its backslash.
 * @param searchPath     Extra directories searched for included files.
 * @param bibliography   Bibliography files, relative to the project root, parsed in addition to those the
 *                       document names.
 * @param citationStyle  How citations are displayed.
 */
public record Configuration(
    Metadata metadata,
    List<Tab> tabs,
    Map<String, EnvironmentStyle> environments,
    Map<String, CounterRule> counters,
    Map<String, String> mathMacros,
    List<Path> searchPath,
    List<String> bibliography,
    CitationStyle citationStyle
) {
    public Configuration {
        tabs = List.copyOf(tabs);
        environments = Map.copyOf(environments);
        counters = Map.copyOf(counters);
        mathMacros = Map.copyOf(mathMacros);
        searchPath = List.copyOf(searchPath);
        bibliography = List.copyOf(bibliography);
    }

    public static Configuration defaults() {
        return new Configuration(
            Metadata.empty,
            List.of(),
            Map.of(),
            Map.of(),
            Map.of(),
            List.of(),
            List.of(),
            CitationStyle.KEY
        );
    }

    /**
     * Returns the numbering rule of a built-in counter such as {@code equation} or {@code footnote}.
     */
    public CounterRule counterRule(final String counter) {
        final var configured = counters.get(counter);
        if (configured != null) {
            return configured;
        }
        return counter.equals("footnote")
            ? new CounterRule(NumberingScheme.SEQUENTIAL, ResetScope.PER_CHAPTER)
            : CounterRule.perChapter;
    }

    /**
     * Returns the effective document language: the override if given, English otherwise.
     */
    public String language() {
        final var language = metadata.language();
        return (language != null) ? language : "en";
    }

    /**
     * The names of the counters not tied to an environment.
     */
    public static final List<String> builtInCounters = List.of(
        "equation",
        "figure",
        "table",
        "listing",
        "algorithm",
        "footnote"
    );
}
