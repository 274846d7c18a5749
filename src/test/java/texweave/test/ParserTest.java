// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.diagnostic.Diagnostic;
import texweave.diagnostic.DiagnosticCollector;
import texweave.diagnostic.DiagnosticKind;
import texweave.document.DiagramRendering;
import texweave.document.DivisionLevel;
import texweave.document.EnvironmentKind;
import texweave.document.FormattingStyle;
import texweave.document.Node;
import texweave.document.ReferenceKind;

final class ParserTest {
    @Test
    void nestsDivisions() {
        final var root = Documents.parse(Documents.lines(
            "\\chapter{One}",
            "Text.",
            "\\section{Two}",
            "More.",
            "\\chapter*{Three}"
        ));
        Assertions.assertThat(root.children()).hasSize(2);
        final var one = (Node.Division) root.children().get(0);
        Assertions.assertThat(one.level()).isEqualTo(DivisionLevel.CHAPTER);
        Assertions.assertThat(one.numbered()).isTrue();
        Assertions.assertThat(Documents.text(one.title())).isEqualTo("One");
        Assertions.assertThat(one.children()).hasSize(2);
        Assertions.assertThat(one.children().get(0)).isInstanceOfSatisfying(Node.Paragraph.class, paragraph ->
            Assertions.assertThat(Documents.text(paragraph)).isEqualTo("Text."));
        Assertions.assertThat(one.children().get(1)).isInstanceOfSatisfying(Node.Division.class, two -> {
            Assertions.assertThat(two.level()).isEqualTo(DivisionLevel.SECTION);
            Assertions.assertThat(Documents.text(two.children())).isEqualTo("More.");
        });
        final var three = (Node.Division) root.children().get(1);
        Assertions.assertThat(three.numbered()).isFalse();
    }

    @Test
    void splitsParagraphsAtBlankLines() {
        final var root = Documents.parse("First\nline.\n\nSecond.");
        Assertions.assertThat(root.children())
            .extracting(Documents::text)
            .containsExactly("First line.", "Second.");
    }

    @Test
    void marksTheAppendix() {
        final var root = Documents.parse("\\chapter{A}\\appendix\\chapter{B}");
        Assertions.assertThat(Documents.find(root, Node.Division.class))
            .extracting(Node.Division::appendix)
            .containsExactly(false, true);
    }

    @Test
    void parsesTheoremsWithTitlesAndLabels() {
        final var root = Documents.parse("\\begin{theorem}[Main]\\label{thm:main}Body.\\end{theorem}");
        final var theorem = Documents.only(root, Node.Environment.class);
        Assertions.assertThat(theorem.name()).isEqualTo("theorem");
        Assertions.assertThat(theorem.kind()).isEqualTo(EnvironmentKind.THEOREM_LIKE);
        Assertions.assertThat(Documents.text(theorem.title())).isEqualTo("Main");
        final var label = Documents.only(root, Node.Label.class);
        Assertions.assertThat(label.key()).isEqualTo("thm:main");
        Assertions.assertThat(label.target()).isEqualTo(theorem.id());
    }

    @Test
    void nestsProofsInsideTheorems() {
        final var root = Documents.parse("\\begin{theorem}Claim.\\begin{proof}Easy.\\end{proof}\\end{theorem}");
        final var theorem = (Node.Environment) root.children().get(0);
        Assertions.assertThat(theorem.children()).hasSize(2);
        Assertions.assertThat(theorem.children().get(1)).isInstanceOfSatisfying(Node.Environment.class, proof -> {
            Assertions.assertThat(proof.kind()).isEqualTo(EnvironmentKind.PROOF);
            Assertions.assertThat(Documents.text(proof.children())).isEqualTo("Easy.");
        });
    }

    @Test
    void attachesLabelsToTheInnermostNumberedNode() {
        final var root = Documents.parse(Documents.lines(
            "\\chapter{One}\\label{ch:one}",
            "\\begin{proof}\\label{in:proof}\\end{proof}",
            "\\begin{figure}\\includegraphics{plot}\\caption{Plot}\\label{fig:plot}\\end{figure}"
        ));
        final var chapter = Documents.only(root, Node.Division.class);
        final var figure = Documents.only(root, Node.Figure.class);
        Assertions.assertThat(Documents.find(root, Node.Label.class))
            .extracting(Node.Label::target)
            .containsExactly(chapter.id(), chapter.id(), figure.id());
        Assertions.assertThat(figure.children())
            .hasExactlyElementsOfTypes(Node.Image.class, Node.Caption.class, Node.Label.class);
    }

    @Test
    void attachesLabelsInSectioningTitlesToTheirDivision() {
        final var root = Documents.parse(Documents.lines(
            "\\chapter{One}",
            "\\section{Intro\\label{sec:intro}}",
            "\\chapter{Two\\label{ch:two}}",
            "\\section*{Aside\\label{aside}}"
        ));
        final var divisions = Documents.find(root, Node.Division.class);
        Assertions.assertThat(divisions).hasSize(4);
        Assertions.assertThat(Documents.find(root, Node.Label.class))
            .extracting(Node.Label::key, Node.Label::target)
            .containsExactly(
                Assertions.tuple("sec:intro", divisions.get(1).id()),
                Assertions.tuple("ch:two", divisions.get(2).id()),
                Assertions.tuple("aside", divisions.get(2).id())
            );
    }

    @Test
    void parsesLists() {
        final var root = Documents.parse("\\begin{enumerate}\\item One \\item[b)] Two\\end{enumerate}");
        final var list = Documents.only(root, Node.Environment.class);
        Assertions.assertThat(list.kind()).isEqualTo(EnvironmentKind.LIST);
        Assertions.assertThat(list.children()).hasSize(2);
        final var items = Documents.find(root, Node.ListItem.class);
        Assertions.assertThat(items).extracting(item -> Documents.text(item.children())).containsExactly("One", "Two");
        Assertions.assertThat(Documents.text(items.get(1).label())).isEqualTo("b)");
    }

    @Test
    void parsesMath() {
        final var root = Documents.parse("Let $x$ be.\n\\begin{equation}\\label{eq:x}x = 1\\end{equation}");
        final var math = Documents.find(root, Node.MathBlock.class);
        Assertions.assertThat(math).hasSize(2);
        Assertions.assertThat(math.get(0).display()).isFalse();
        Assertions.assertThat(math.get(1)).satisfies(block -> {
            Assertions.assertThat(block.display()).isTrue();
            Assertions.assertThat(block.environment()).isEqualTo("equation");
            Assertions.assertThat(block.source()).isEqualTo("x = 1");
        });
        Assertions.assertThat(Documents.only(root, Node.Label.class).target()).isEqualTo(math.get(1).id());
        Assertions.assertThat(Documents.text(root.children().get(0))).isEqualTo("Let $x$ be.");
    }

    @Test
    void parsesReferences() {
        final var root = Documents.parse("See \\ref{a}, \\eqref{b} and \\cite[p.~2]{k1, k2}.");
        Assertions.assertThat(Documents.find(root, Node.CrossRef.class))
            .extracting(reference -> reference.kind() + ":" + reference.key())
            .containsExactly("REF:a", "EQREF:b", "CITE:k1", "CITE:k2");
    }

    @Test
    void parsesFormatting() {
        final var root = Documents.parse("\\textbf{bold \\emph{both}} {\\itshape slanted}");
        final var formatting = Documents.find(root, Node.Formatting.class);
        Assertions.assertThat(formatting)
            .extracting(Node.Formatting::style)
            .containsExactly(FormattingStyle.BOLD, FormattingStyle.EMPHASIS, FormattingStyle.ITALIC);
        Assertions.assertThat(Documents.text(formatting.get(0))).isEqualTo("bold both");
    }

    @Test
    void parsesCodeListings() {
        final var root = Documents.parse(Documents.lines(
            "\\begin{lstlisting}[language=Java, caption={Hello}, label=lst:hello, numbers=left]",
            "int x;",
            "\\end{lstlisting}"
        ));
        final var code = Documents.only(root, Node.CodeBlock.class);
        Assertions.assertThat(code.language()).isEqualTo("Java");
        Assertions.assertThat(code.caption()).isEqualTo("Hello");
        Assertions.assertThat(code.text()).isEqualTo("int x;");
        Assertions.assertThat(code.lineNumbers()).isTrue();
        Assertions.assertThat(Documents.only(root, Node.Label.class).target()).isEqualTo(code.id());
    }

    @Test
    void keepsDiagramSource() {
        final var root = Documents.parse("\\begin{tikzpicture}\\draw (0,0) -- (1,1);\\end{tikzpicture}");
        final var diagram = Documents.only(root, Node.DiagramBlock.class);
        Assertions.assertThat(diagram.source())
            .isEqualTo("\\begin{tikzpicture}\\draw (0,0) -- (1,1);\\end{tikzpicture}");
        Assertions.assertThat(diagram.rendering()).isInstanceOf(DiagramRendering.Pending.class);
    }

    @Test
    void parsesAlgorithms() {
        final var root = Documents.parse(Documents.lines(
            "\\begin{algorithm}",
            "\\caption{Euclid}\\label{alg:euclid}",
            "\\begin{algorithmic}[1]",
            "\\State $r \\gets a \\bmod b$",
            "\\end{algorithmic}",
            "\\end{algorithm}",
            "\\begin{algorithmic}",
            "\\Return $b$",
            "\\end{algorithmic}",
            "\\begin{algorithm2e}[H]",
            "\\caption{Sum of $n$ numbers}\\label{alg:sum}",
            "$s \\gets 0$\\;",
            "\\end{algorithm2e}"
        ));
        final var algorithms = Documents.find(root, Node.Algorithm.class);
        Assertions.assertThat(algorithms)
            .extracting(Node.Algorithm::environment)
            .containsExactly("algorithm", "algorithmic", "algorithm2e");
        Assertions.assertThat(algorithms.get(0).children())
            .hasExactlyElementsOfTypes(Node.Caption.class, Node.Label.class, Node.Pseudocode.class);
        Assertions.assertThat(Documents.find(root, Node.Pseudocode.class))
            .extracting(pseudocode -> pseudocode.lines().get(0).text())
            .containsExactly("$r \\gets a \\bmod b$", "$b$", "$s \\gets 0$");
        Assertions.assertThat(Documents.find(root, Node.Label.class))
            .extracting(Node.Label::key, Node.Label::target)
            .containsExactly(
                Assertions.tuple("alg:euclid", algorithms.get(0).id()),
                Assertions.tuple("alg:sum", algorithms.get(2).id())
            );
        final var caption = Documents.find(algorithms.get(2), Node.Caption.class).get(0);
        Assertions.assertThat(caption.children())
            .hasExactlyElementsOfTypes(Node.Text.class, Node.MathBlock.class, Node.Text.class);
        Assertions.assertThat(Documents.text(caption)).isEqualTo("Sum of $n$ numbers");
    }

    @Test
    void parsesTables() {
        final var root = Documents.parse(Documents.lines(
            "\\begin{table}",
            "\\begin{tabular}{ll}",
            "a & b \\\\",
            "\\multicolumn{2}{c}{wide}",
            "\\end{tabular}",
            "\\caption{Numbers}",
            "\\end{table}"
        ));
        final var table = Documents.only(root, Node.Table.class);
        final var tabular = Documents.only(table, Node.Tabular.class);
        Assertions.assertThat(tabular.columnSpec()).isEqualTo("ll");
        final var rows = Documents.find(tabular, Node.TableRow.class);
        Assertions.assertThat(rows).hasSize(2);
        Assertions.assertThat(rows.get(0).children()).extracting(Documents::text).containsExactly("a", "b");
        Assertions.assertThat(rows.get(1).children()).singleElement().isInstanceOfSatisfying(Node.TableCell.class,
            cell -> {
                Assertions.assertThat(cell.columnSpan()).isEqualTo(2);
                Assertions.assertThat(Documents.text(cell)).isEqualTo("wide");
            });
        Assertions.assertThat(Documents.find(table, Node.Caption.class)).hasSize(1);
    }

    @Test
    void stopsAtTheEndOfTheDocument() {
        final var root = Documents.parse("\\begin{document}Body.\\end{document}Ignored.");
        Assertions.assertThat(Documents.text(root.children())).isEqualTo("Body.");
    }

    @Test
    void rejectsSectioningInsideEnvironments() {
        final var collected = DiagnosticCollector.collect(() ->
            Documents.parse("\\chapter{A}\\begin{theorem}\\section{B}\\end{theorem}"));
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNEXPECTED_SECTIONING_AT_DEPTH);
    }

    @Test
    void rejectsSkippedSectioningLevels() {
        final var collected = DiagnosticCollector.collect(() -> Documents.parse("\\chapter{A}\\subsection{B}"));
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNEXPECTED_SECTIONING_AT_DEPTH);
    }

    @Test
    void treatsSectionsAsTopLevelInArticles() {
        final var root = Documents.parse("\\section{A}\\subsection{B}", DivisionLevel.SECTION);
        Assertions.assertThat(Documents.find(root, Node.Division.class))
            .extracting(Node.Division::level)
            .containsExactly(DivisionLevel.SECTION, DivisionLevel.SUBSECTION);
    }

    @Test
    void rejectsMisplacedClosingBraces() {
        final var collected = DiagnosticCollector.collect(() -> Documents.parse("\\begin{theorem}}\\end{theorem}"));
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNMATCHED_BRACE);
    }

    @Test
    void namesTheEnclosingConstructInStructuralErrors() {
        final var sectioning = DiagnosticCollector.collect(() ->
            Documents.parse("\\chapter{A}\\begin{itemize}\\item \\section{B}\\end{itemize}"));
        Assertions.assertThat(sectioning.fatalDiagnostics())
            .extracting(Diagnostic::message)
            .containsExactly("\\section inside \\begin{itemize}");
        final var skipped = DiagnosticCollector.collect(() -> Documents.parse("\\chapter{A}\\subsection{B}"));
        Assertions.assertThat(skipped.fatalDiagnostics())
            .extracting(Diagnostic::message)
            .containsExactly("\\subsection cannot appear directly inside a \\chapter");
    }
}
