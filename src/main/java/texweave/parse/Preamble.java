// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.parse;

import java.util.List;
import java.util.Map;
import java.util.Set;
import texweave.config.CounterRule;
import texweave.config.EnvironmentStyle;
import texweave.config.Metadata;
import texweave.document.DivisionLevel;

/**
 * What the preamble declares.
 *
 * @param documentClass The document class, {@code book} if none is declared.
 * @param metadata      Title, subtitle, author and date, as plain text.
 * @param environments  Environments defined with {@code \newtheorem} and {@code \newtcolorbox}, in order.
 * @param counterRules  Counter rules changed with {@code \numberwithin}.
 * @param mathMacros    Math macros from {@code \newcommand}, {@code \def} and {@code \DeclareMathOperator}.
 * @param graphicsPaths Directories named by {@code \graphicspath}.
 * @param diagramSetup  TikZ and PGFPlots declarations diagrams need, as written: {@code \\usetikzlibrary},
 *                      {@code \tikzset}, {@code \pgfplotsset} and the {@code \\usepackage} lines loading TikZ or
 *                      PGFPlots packages.
 */
public record Preamble(
    String documentClass,
    Metadata metadata,
    Map<String, EnvironmentStyle> environments,
    Map<String, CounterRule> counterRules,
    Map<String, String> mathMacros,
    List<String> graphicsPaths,
    List<String> diagramSetup
) {
    public Preamble {
        environments = Map.copyOf(environments);
        counterRules = Map.copyOf(counterRules);
        mathMacros = Map.copyOf(mathMacros);
        graphicsPaths = List.copyOf(graphicsPaths);
        diagramSetup = List.copyOf(diagramSetup);
    }

    public static final Preamble empty =
        new Preamble("book", Metadata.empty, Map.of(), Map.of(), Map.of(), List.of(), List.of());

    /**
     * Returns whether the class has no chapters, making {@code \section} the top sectioning level.
     */
    public boolean isArticleLike() {
        return articleClasses.contains(documentClass);
    }

    /**
     * Returns the outermost level below {@code \part}.
     */
    public DivisionLevel topLevel() {
        return isArticleLike() ? DivisionLevel.SECTION : DivisionLevel.CHAPTER;
    }

    private static final Set<String> articleClasses = Set.of("article", "amsart", "scrartcl", "extarticle");
}
