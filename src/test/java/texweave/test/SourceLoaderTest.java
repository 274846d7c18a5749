// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.nio.file.Path;
import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.diagnostic.Diagnostic;
import texweave.diagnostic.DiagnosticCollector;
import texweave.diagnostic.DiagnosticKind;
import texweave.document.DivisionLevel;
import texweave.document.Node;
import texweave.source.SourceFile;
import texweave.source.SourceLoader;
import texweave.source.SourceOrigin;
import texweave.source.SourceText;

final class SourceLoaderTest {
    @Test
    void expandsNestedInclusions() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "Start \\input{a} End")
            .with("a.tex", "A \\include{sub/b}")
            .with("sub/b.tex", "B");
        final var source = SourceLoader.load(reader, Documents.mainFile, List.of());
        Assertions.assertThat(source.text()).isEqualTo("Start A B End");
        Assertions.assertThat(source.files())
            .extracting(SourceFile::displayName)
            .containsExactly("main.tex", "a.tex", "sub/b.tex");
    }

    @Test
    void mapsOffsetsBackToTheirFiles() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "one\n\\input{a}\nthree")
            .with("a.tex", "\n  two");
        final var source = SourceLoader.load(reader, Documents.mainFile, List.of());
        final var text = source.text();
        Assertions.assertThat(source.originAt(text.indexOf("two"))).isEqualTo(new SourceOrigin("a.tex", 2, 3));
        Assertions.assertThat(source.originAt(text.indexOf("three"))).isEqualTo(new SourceOrigin("main.tex", 3, 1));
    }

    @Test
    void resolvesImportsAgainstTheirDirectory() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\import{parts/}{one}")
            .with("parts/one.tex", "One \\input{two}")
            .with("parts/two.tex", "two");
        final var source = SourceLoader.load(reader, Documents.mainFile, List.of());
        Assertions.assertThat(source.text()).isEqualTo("One two");
    }

    @Test
    void searchesTheConfiguredPath() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\input{macros}")
            .with("lib/macros.tex", "found");
        final var source = SourceLoader.load(reader, Documents.mainFile, List.of(Path.of("lib")));
        Assertions.assertThat(source.text()).isEqualTo("found");
    }

    @Test
    void leavesCommentsAndVerbatimAlone() {
        final var text = "% \\input{a}\n\\begin{verbatim}\\input{a}\\end{verbatim} \\verb|\\input{a}|";
        final var reader = new MemorySourceReader()
            .with("main.tex", text)
            .with("a.tex", "included");
        final var collected = load(reader);
        Assertions.assertThat(collected.diagnostics()).isEmpty();
        Assertions.assertThat(collected.value()).isNotNull();
        Assertions.assertThat(collected.value().text()).isEqualTo(text);
        Assertions.assertThat(reader.readPaths()).containsExactly(reader.path("main.tex"));
    }

    @Test
    void keepsTrailingCommentsInsideTheirFile() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\input{a} \\section{B}")
            .with("a.tex", "A % trailing note");
        final var source = SourceLoader.load(reader, Documents.mainFile, List.of());
        Assertions.assertThat(source.text()).isEqualTo("A  \\section{B}");
        Assertions.assertThat(source.originAt(source.text().indexOf("\\section")))
            .isEqualTo(new SourceOrigin("main.tex", 1, 11));
        final var root = Documents.parse(source.text(), DivisionLevel.SECTION);
        Assertions.assertThat(Documents.find(root, Node.Division.class)).hasSize(1);
        final var escaped = SourceLoader.load(
            new MemorySourceReader().with("main.tex", "\\input{b} end").with("b.tex", "50\\% done\n% note\nlast 5\\%"),
            Documents.mainFile,
            List.of()
        );
        Assertions.assertThat(escaped.text()).isEqualTo("50\\% done\n% note\nlast 5\\% end");
    }

    @Test
    void allowsRepeatedInclusion() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\input{a}\\input{a}")
            .with("a.tex", "x");
        final var source = SourceLoader.load(reader, Documents.mainFile, List.of());
        Assertions.assertThat(source.text()).isEqualTo("xx");
    }

    @Test
    void warnsAboutMissingInclusions() {
        final var reader = new MemorySourceReader().with("main.tex", "x \\input{nope} y");
        final var collected = load(reader);
        Assertions.assertThat(collected.isAborted()).isFalse();
        Assertions.assertThat(collected.value().text()).isEqualTo("x  y");
        Assertions.assertThat(collected.warnings()).singleElement().satisfies(diagnostic -> {
            Assertions.assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.MISSING_SOURCE);
            Assertions.assertThat(diagnostic.origin()).isEqualTo(new SourceOrigin("main.tex", 1, 3));
        });
    }

    @Test
    void rejectsCycles() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\input{a}")
            .with("a.tex", "\\input{b}")
            .with("b.tex", "\\input{a}");
        final var collected = load(reader);
        Assertions.assertThat(collected.isAborted()).isTrue();
        Assertions.assertThat(collected.fatalDiagnostics()).singleElement().satisfies(diagnostic -> {
            Assertions.assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.CYCLIC_INCLUDE);
            Assertions.assertThat(diagnostic.message()).contains("a.tex -> b.tex -> a.tex");
            Assertions.assertThat(diagnostic.origin()).isEqualTo(new SourceOrigin("b.tex", 1, 1));
        });
    }

    @Test
    void rejectsSelfInclusion() {
        final var reader = new MemorySourceReader().with("main.tex", "\\input{main}");
        final var collected = load(reader);
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.CYCLIC_INCLUDE);
    }

    @Test
    void reportsUnreadableFiles() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\input{secret}")
            .unreadable("secret.tex");
        final var collected = load(reader);
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNREADABLE_SOURCE);
    }

    @Test
    void reportsMissingMainFile() {
        final var collected = load(new MemorySourceReader());
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNREADABLE_SOURCE);
    }

    @Test
    void collectsBibliographies() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\addbibresource{refs.bib}\\bibliography{more,missing}")
            .with("refs.bib", "@book{a, title={A}}")
            .with("more.bib", "@book{b, title={B}}");
        final var collected = DiagnosticCollector.collect(() ->
            SourceLoader.load(reader, Documents.mainFile, List.of(), List.of("refs")));
        Assertions.assertThat(collected.value().bibliographyFiles())
            .extracting(SourceFile::displayName)
            .containsExactly("refs.bib", "more.bib");
        Assertions.assertThat(collected.warnings())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.MISSING_SOURCE);
    }

    private static DiagnosticCollector.Collected<SourceText> load(final MemorySourceReader reader) {
        return DiagnosticCollector.collect(() -> SourceLoader.load(reader, Documents.mainFile, List.of()));
    }
}
