// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.config.CounterRule;
import texweave.config.NumberingScheme;
import texweave.config.ResetScope;
import texweave.document.DivisionLevel;
import texweave.document.EnvironmentKind;
import texweave.parse.DocumentBoundary;
import texweave.parse.Preamble;
import texweave.parse.PreambleReader;

final class PreambleReaderTest {
    @Test
    void readsClassAndMetadata() {
        final var preamble = read(Documents.lines(
            "\\documentclass[12pt]{article}",
            "\\title{A Small --- Book}",
            "\\author{Ada Writer \\and Bo Reader}",
            "\\date{2022}",
            "\\begin{document}",
            "\\end{document}"
        ));
        Assertions.assertThat(preamble.documentClass()).isEqualTo("article");
        Assertions.assertThat(preamble.topLevel()).isEqualTo(DivisionLevel.SECTION);
        Assertions.assertThat(preamble.metadata().title()).isEqualTo("A Small — Book");
        Assertions.assertThat(preamble.metadata().author()).isEqualTo("Ada Writer, Bo Reader");
        Assertions.assertThat(preamble.metadata().date()).isEqualTo("2022");
    }

    @Test
    void defaultsToBookClass() {
        final var preamble = read("\\usepackage{amsmath}\n\\begin{document}\\end{document}");
        Assertions.assertThat(preamble.documentClass()).isEqualTo("book");
        Assertions.assertThat(preamble.topLevel()).isEqualTo(DivisionLevel.CHAPTER);
    }

    @Test
    void declaresTheorems() {
        final var preamble = read(Documents.lines(
            "\\newtheorem{theorem}{Theorem}[chapter]",
            "\\newtheorem{lemma}[theorem]{Lemma}",
            "\\newtheorem{remark}{Remark}",
            "\\newtheorem*{claim}{Claim}",
            "\\begin{document}\\end{document}"
        ));
        final var environments = preamble.environments();
        Assertions.assertThat(environments.get("theorem")).satisfies(style -> {
            Assertions.assertThat(style.kind()).isEqualTo(EnvironmentKind.THEOREM_LIKE);
            Assertions.assertThat(style.displayLabel()).isEqualTo("Theorem");
            Assertions.assertThat(style.counterRule()).isEqualTo(CounterRule.perChapter);
        });
        Assertions.assertThat(environments.get("lemma")).satisfies(style -> {
            Assertions.assertThat(style.counter()).isEqualTo("theorem");
            Assertions.assertThat(style.counterRule()).isEqualTo(CounterRule.perChapter);
        });
        Assertions.assertThat(environments.get("remark")).satisfies(style -> {
            Assertions.assertThat(style.counter()).isEqualTo("remark");
            Assertions.assertThat(style.numbering()).isEqualTo(NumberingScheme.SEQUENTIAL);
            Assertions.assertThat(style.reset()).isEqualTo(ResetScope.GLOBAL);
        });
        Assertions.assertThat(environments.get("claim").isNumbered()).isFalse();
    }

    @Test
    void collectsMathMacros() {
        final var preamble = read(Documents.lines(
            "\\newcommand{\\R}{\\mathbb{R}}",
            "\\renewcommand{\\vec}[1]{\\mathbf{#1}}",
            "\\def\\eps{\\varepsilon}",
            "\\DeclareMathOperator{\\Hom}{Hom}",
            "\\DeclareMathOperator*{\\argmax}{arg\\,max}",
            "\\begin{document}\\end{document}"
        ));
        Assertions.assertThat(preamble.mathMacros())
            .containsEntry("\\R", "\\mathbb{R}")
            .containsEntry("\\vec", "\\mathbf{#1}")
            .containsEntry("\\eps", "\\varepsilon")
            .containsEntry("\\Hom", "\\operatorname{Hom}")
            .containsEntry("\\argmax", "\\operatorname*{arg\\,max}");
    }

    @Test
    void readsGraphicsPathsAndCounterRules() {
        final var preamble = read(Documents.lines(
            "\\graphicspath{{figures/}{images/}}",
            "\\numberwithin{equation}{section}",
            "\\begin{document}\\end{document}"
        ));
        Assertions.assertThat(preamble.graphicsPaths()).containsExactly("figures/", "images/");
        Assertions.assertThat(preamble.counterRules())
            .containsEntry("equation", new CounterRule(NumberingScheme.HIERARCHICAL, ResetScope.PER_SECTION));
    }

    @Test
    void labelsBoxesByTheirTitle() {
        final var preamble = read(Documents.lines(
            "\\newtcolorbox{insight}[1][]{title=Key insight}",
            "\\newtcolorbox{aside}{colback=white}",
            "\\begin{document}\\end{document}"
        ));
        Assertions.assertThat(preamble.environments().get("insight").displayLabel()).isEqualTo("Key insight");
        Assertions.assertThat(preamble.environments().get("aside").displayLabel()).isEqualTo("Aside");
        Assertions.assertThat(preamble.environments().get("aside").kind()).isEqualTo(EnvironmentKind.CUSTOM);
    }

    @Test
    void collectsDiagramSetup() {
        final var preamble = read(Documents.lines(
            "\\usepackage{amsmath}",
            "\\usepackage[all]{tikz-cd,xcolor}",
            "\\usepackage{pgfplots}",
            "\\usetikzlibrary{automata, positioning}",
            "\\tikzset{state/.style={circle, draw={black}}}",
            "\\pgfplotsset{compat=1.18}",
            "\\begin{document}\\end{document}"
        ));
        Assertions.assertThat(preamble.diagramSetup()).containsExactly(
            "\\usepackage[all]{tikz-cd,xcolor}",
            "\\usepackage{pgfplots}",
            "\\usetikzlibrary{automata, positioning}",
            "\\tikzset{state/.style={circle, draw={black}}}",
            "\\pgfplotsset{compat=1.18}"
        );
        Assertions.assertThat(read("\\begin{document}\\end{document}").diagramSetup()).isEmpty();
    }

    private static Preamble read(final String text) {
        final var source = Documents.source(text);
        return PreambleReader.read(source, 0, DocumentBoundary.bodyStart(source));
    }
}
