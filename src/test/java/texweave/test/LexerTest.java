// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.diagnostic.DiagnosticCollector;
import texweave.diagnostic.DiagnosticKind;
import texweave.lexer.Lexer;
import texweave.lexer.Token;
import texweave.source.SourceOrigin;

final class LexerTest {
    @Test
    void splitsCommandsGroupsAndText() {
        final var tokens = tokenize("\\textbf{bold} text");
        Assertions.assertThat(tokens).hasSize(5);
        Assertions.assertThat(tokens.get(0)).isInstanceOfSatisfying(Token.Command.class, command -> {
            Assertions.assertThat(command.name()).isEqualTo("textbf");
            Assertions.assertThat(command.starred()).isFalse();
        });
        Assertions.assertThat(tokens.get(1)).isInstanceOf(Token.BeginGroup.class);
        Assertions.assertThat(tokens.get(2)).isEqualTo(new Token.Text("bold", 8, 12));
        Assertions.assertThat(tokens.get(3)).isInstanceOf(Token.EndGroup.class);
        Assertions.assertThat(tokens.get(4)).isEqualTo(new Token.Text(" text", 13, 18));
    }

    @Test
    void dropsComments() {
        final var tokens = tokenize("a % not here\n    b");
        Assertions.assertThat(tokens)
            .extracting(token -> ((Token.Text) token).text())
            .containsExactly("a ", "b");
    }

    @Test
    void capturesRawArguments() {
        final var tokens = tokenize("\\label{thm:main}\\ref*{x}");
        Assertions.assertThat(tokens.get(0)).isInstanceOfSatisfying(Token.Command.class, command ->
            Assertions.assertThat(command.argument(0)).isEqualTo("thm:main"));
        Assertions.assertThat(tokens.get(1)).isInstanceOfSatisfying(Token.Command.class, command -> {
            Assertions.assertThat(command.starred()).isTrue();
            Assertions.assertThat(command.argument(0)).isEqualTo("x");
        });
    }

    @Test
    void extractsLabelsFromMath() {
        final var tokens = tokenize("\\begin{equation}\\label{eq:x} a = b \\end{equation}");
        Assertions.assertThat(tokens).singleElement().isInstanceOfSatisfying(Token.Math.class, math -> {
            Assertions.assertThat(math.environment()).isEqualTo("equation");
            Assertions.assertThat(math.display()).isTrue();
            Assertions.assertThat(math.source()).isEqualTo("a = b");
            Assertions.assertThat(math.labels()).extracting(Token.LabelOccurrence::key).containsExactly("eq:x");
        });
    }

    @Test
    void recognizesEveryMathDelimiter() {
        final var tokens = tokenize("$a$ \\(b\\) \\[c\\] $$d$$");
        Assertions.assertThat(tokens)
            .filteredOn(Token.Math.class::isInstance)
            .extracting(token -> ((Token.Math) token).source() + ":" + ((Token.Math) token).display())
            .containsExactly("a:false", "b:false", "c:true", "d:true");
    }

    @Test
    void endsVerbatimOnlyAtItsOwnName() {
        final var tokens = tokenize("\\begin{verbatim}\n\\begin{itemize} \\end{itemize}\n\\end{verbatim}");
        Assertions.assertThat(tokens).singleElement().isInstanceOfSatisfying(Token.Verbatim.class, verbatim -> {
            Assertions.assertThat(verbatim.environment()).isEqualTo("verbatim");
            Assertions.assertThat(verbatim.text()).isEqualTo("\\begin{itemize} \\end{itemize}");
            Assertions.assertThat(verbatim.inline()).isFalse();
        });
    }

    @Test
    void readsInlineVerbatimWithAnyDelimiter() {
        final var tokens = tokenize("\\verb|a{b| rest");
        Assertions.assertThat(tokens.get(0)).isInstanceOfSatisfying(Token.Verbatim.class, verbatim -> {
            Assertions.assertThat(verbatim.text()).isEqualTo("a{b");
            Assertions.assertThat(verbatim.inline()).isTrue();
        });
    }

    @Test
    void composesAccents() {
        final var tokens = tokenize("caf\\'e");
        final var text = new StringBuilder();
        for (final var token : tokens) {
            text.append(((Token.Text) token).text());
        }
        Assertions.assertThat(text.toString()).isEqualTo("café");
    }

    @Test
    void reportsUnclosedBrace() {
        final var collected = DiagnosticCollector.collect(() -> tokenize("ok\n{abc"));
        Assertions.assertThat(collected.isAborted()).isTrue();
        Assertions.assertThat(collected.fatalDiagnostics()).singleElement().satisfies(diagnostic -> {
            Assertions.assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.UNMATCHED_BRACE);
            Assertions.assertThat(diagnostic.origin()).isEqualTo(new SourceOrigin("main.tex", 2, 1));
        });
    }

    @Test
    void reportsMismatchedEnvironment() {
        final var collected = DiagnosticCollector.collect(() -> tokenize("\\begin{theorem}x\\end{lemma}"));
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(diagnostic -> diagnostic.kind())
            .containsExactly(DiagnosticKind.UNMATCHED_ENVIRONMENT);
    }

    @Test
    void reportsUnterminatedMath() {
        final var collected = DiagnosticCollector.collect(() -> tokenize("$a + b\n\nnext"));
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(diagnostic -> diagnostic.kind())
            .containsExactly(DiagnosticKind.UNTERMINATED_MATH);
    }

    @Test
    void limitsNesting() {
        final var text = "{".repeat(Lexer.maxDepth + 1) + "}".repeat(Lexer.maxDepth + 1);
        final var collected = DiagnosticCollector.collect(() -> tokenize(text));
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(diagnostic -> diagnostic.kind())
            .containsExactly(DiagnosticKind.NESTING_TOO_DEEP);
    }

    private static List<Token> tokenize(final String text) {
        final var source = Documents.source(text);
        return Lexer.tokenize(source, 0, source.length());
    }
}
