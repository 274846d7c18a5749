// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.util.List;
import java.util.Map;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.config.Configuration;
import texweave.config.CounterRule;
import texweave.config.EnvironmentTable;
import texweave.config.NumberingScheme;
import texweave.config.ResetScope;
import texweave.document.DivisionLevel;
import texweave.document.Node;
import texweave.numbering.NumberingEngine;
import texweave.numbering.NumberingPlan;

final class NumberingEngineTest {
    @Test
    void numbersTheoremsWithinChapters() {
        final var root = number(Documents.lines(
            "\\chapter{One}",
            "\\begin{theorem}A\\end{theorem}",
            "\\begin{theorem}B\\end{theorem}",
            "\\begin{lemma}C\\end{lemma}",
            "\\begin{theorem}D\\end{theorem}",
            "\\chapter{Two}",
            "\\begin{theorem}E\\end{theorem}"
        ));
        Assertions.assertThat(Documents.find(root, Node.Environment.class))
            .extracting(Node::number)
            .containsExactly("1.1", "1.2", "1.1", "1.3", "2.1");
    }

    @Test
    void leavesUnnumberedEnvironmentsAlone() {
        final var root = number("\\chapter{One}\\begin{proof}P\\end{proof}\\begin{mystery}M\\end{mystery}");
        Assertions.assertThat(Documents.find(root, Node.Environment.class))
            .extracting(Node::number)
            .containsOnlyNulls();
    }

    @Test
    void numbersDivisionsAndTheAppendix() {
        final var root = number(Documents.lines(
            "\\chapter{One}",
            "\\section{A}",
            "\\subsection{A1}",
            "\\section*{Unnumbered}",
            "\\section{B}",
            "\\chapter{Two}",
            "\\section{C}",
            "\\appendix",
            "\\chapter{Extra}",
            "\\section{D}",
            "\\begin{theorem}T\\end{theorem}",
            "\\chapter{More}"
        ));
        Assertions.assertThat(Documents.find(root, Node.Division.class))
            .extracting(Node::number)
            .containsExactly("1", "1.1", "1.1.1", null, "1.2", "2", "2.1", "A", "A.1", "B");
        Assertions.assertThat(Documents.only(root, Node.Environment.class).number()).isEqualTo("A.1");
    }

    @Test
    void numbersPartsWithRomanNumeralsWithoutRestartingChapters() {
        final var root = number(Documents.lines(
            "\\part{First}",
            "\\chapter{One}",
            "\\part{Second}",
            "\\chapter{Two}",
            "\\part{Third}",
            "\\part{Fourth}"
        ));
        Assertions.assertThat(Documents.find(root, Node.Division.class))
            .extracting(Node::number)
            .containsExactly("I", "1", "II", "2", "III", "IV");
    }

    @Test
    void numbersSectionsOfArticles() {
        final var root = number(
            "\\section{A}\\begin{theorem}T\\end{theorem}\\subsection{B}\\section{C}",
            DivisionLevel.SECTION
        );
        Assertions.assertThat(Documents.find(root, Node.Division.class))
            .extracting(Node::number)
            .containsExactly("1", "1.1", "2");
        // Theorems reset per chapter; without a numbered chapter they take their bare value.
        Assertions.assertThat(Documents.only(root, Node.Environment.class).number()).isEqualTo("1");
    }

    @Test
    void numbersEquationsHonoringTagsAndSuppression() {
        final var root = number(Documents.lines(
            "\\chapter{One}",
            "\\begin{equation}a\\end{equation}",
            "\\begin{equation*}b\\end{equation*}",
            "\\[ c \\]",
            "\\begin{align}d \\\\ e \\notag\\end{align}",
            "\\begin{align}f \\notag \\\\ g \\nonumber\\end{align}",
            "\\begin{equation}h \\tag{*}\\end{equation}",
            "\\begin{equation}i\\end{equation}"
        ));
        Assertions.assertThat(Documents.find(root, Node.MathBlock.class))
            .extracting(Node::number)
            .containsExactly("1.1", null, null, "1.2", null, "*", "1.3");
    }

    @Test
    void numbersOnlyCaptionedFloats() {
        final var root = number(Documents.lines(
            "\\chapter{One}",
            "\\begin{figure}\\includegraphics{a.png}\\caption{First}\\end{figure}",
            "\\begin{figure}\\includegraphics{b.png}\\end{figure}",
            "\\begin{table}\\caption{Data}\\begin{tabular}{l}x\\end{tabular}\\end{table}",
            "\\begin{figure}\\caption{Second}\\end{figure}"
        ));
        Assertions.assertThat(Documents.find(root, Node.Figure.class))
            .extracting(Node::number)
            .containsExactly("1.1", null, "1.2");
        Assertions.assertThat(Documents.only(root, Node.Table.class).number()).isEqualTo("1.1");
    }

    @Test
    void numbersAlgorithmsWithinChapters() {
        final var root = number(Documents.lines(
            "\\chapter{One}",
            "\\begin{algorithm}\\caption{A}\\begin{algorithmic}\\State x\\end{algorithmic}\\end{algorithm}",
            "\\begin{algorithmic}\\State y\\end{algorithmic}",
            "\\chapter{Two}",
            "\\begin{algorithm2e}\\caption{B}z\\;\\end{algorithm2e}"
        ));
        Assertions.assertThat(Documents.find(root, Node.Algorithm.class))
            .extracting(Node::number)
            .containsExactly("1.1", "1.2", "2.1");
    }

    @Test
    void numbersFootnotesSequentiallyPerChapter() {
        final var root = number(Documents.lines(
            "\\chapter{One}",
            "A\\footnote{x} B\\footnote{y}",
            "\\section{S}",
            "C\\footnote{z}",
            "\\chapter{Two}",
            "D\\footnote{w}"
        ));
        Assertions.assertThat(Documents.find(root, Node.Footnote.class))
            .extracting(Node::number)
            .containsExactly("1", "2", "3", "1");
    }

    @Test
    void appliesConfiguredCounterRules() {
        final var plan = new NumberingPlan(
            EnvironmentTable.defaults("en"),
            Map.of(
                "theorem", CounterRule.global,
                "equation", new CounterRule(NumberingScheme.HIERARCHICAL, ResetScope.PER_SECTION)
            ),
            DivisionLevel.CHAPTER
        );
        final var root = NumberingEngine.number(Documents.parse(Documents.lines(
            "\\chapter{One}",
            "\\section{S}",
            "\\begin{theorem}A\\end{theorem}",
            "\\begin{equation}x\\end{equation}",
            "\\chapter{Two}",
            "\\section{T}",
            "\\begin{theorem}B\\end{theorem}",
            "\\begin{equation}y\\end{equation}"
        )), plan);
        Assertions.assertThat(Documents.find(root, Node.Environment.class))
            .extracting(Node::number)
            .containsExactly("1", "2");
        Assertions.assertThat(Documents.find(root, Node.MathBlock.class))
            .extracting(Node::number)
            .containsExactly("1.1.1", "2.1.1");
    }

    @Test
    void configurationTakesPrecedenceOverDeclaredRules() {
        final var configuration = new Configuration(
            Configuration.defaults().metadata(),
            List.of(),
            Map.of(),
            Map.of("equation", CounterRule.unnumbered),
            Map.of(),
            List.of(),
            List.of(),
            Configuration.defaults().citationStyle()
        );
        final var plan = NumberingPlan.of(
            configuration,
            Map.of("equation", CounterRule.global, "figure", CounterRule.global),
            EnvironmentTable.defaults("en"),
            DivisionLevel.CHAPTER
        );
        Assertions.assertThat(plan.ruleFor("equation", CounterRule.perChapter)).isEqualTo(CounterRule.unnumbered);
        Assertions.assertThat(plan.ruleFor("figure", CounterRule.perChapter)).isEqualTo(CounterRule.global);
        Assertions.assertThat(plan.ruleFor("table", CounterRule.global)).isEqualTo(CounterRule.perChapter);
    }

    @Test
    void doesNotMutateTheInput() {
        final var parsed = Documents.parse("\\chapter{One}\\begin{theorem}A\\end{theorem}");
        final var numbered = NumberingEngine.number(parsed, defaultPlan(DivisionLevel.CHAPTER));
        Assertions.assertThat(Documents.only(parsed, Node.Environment.class).number()).isNull();
        Assertions.assertThat(Documents.only(numbered, Node.Environment.class).number()).isEqualTo("1.1");
        Assertions.assertThat(NumberingEngine.number(parsed, defaultPlan(DivisionLevel.CHAPTER))).isEqualTo(numbered);
    }

    private static Node.DocumentRoot number(final String body) {
        return number(body, DivisionLevel.CHAPTER);
    }

    private static Node.DocumentRoot number(final String body, final DivisionLevel topLevel) {
        return NumberingEngine.number(Documents.parse(body, topLevel), defaultPlan(topLevel));
    }

    private static NumberingPlan defaultPlan(final DivisionLevel topLevel) {
        return NumberingPlan.of(Configuration.defaults(), Map.of(), EnvironmentTable.defaults("en"), topLevel);
    }
}
