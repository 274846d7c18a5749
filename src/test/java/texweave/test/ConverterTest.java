// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import texweave.config.Configuration;
import texweave.config.ConfigurationLoader;
import texweave.config.Tab;
import texweave.convert.ConversionResult;
import texweave.convert.Converter;
import texweave.diagnostic.Diagnostic;
import texweave.diagnostic.DiagnosticKind;
import texweave.diagram.UnavailableDiagramRenderer;
import texweave.document.EnvironmentKind;
import texweave.document.Node;
import texweave.ir.DocumentIr;
import texweave.ir.DocumentIrWriter;
import texweave.source.FileSystemSourceReader;
import texweave.source.SourceOrigin;

final class ConverterTest {
    @BeforeEach
    void startPool() {
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void stopPool() {
        pool.shutdown();
    }

    @Test
    void convertsTheSampleBook() throws Exception {
        final var ir = convertSampleBook();

        Assertions.assertThat(ir.metadata().title()).isEqualTo("A Small Book, Configured");
        Assertions.assertThat(ir.metadata().author()).isEqualTo("Ada Writer");
        Assertions.assertThat(ir.metadata().date()).isEqualTo("2022");
        Assertions.assertThat(ir.metadata().version()).isEqualTo("1.0");
        Assertions.assertThat(ir.tabs()).containsExactly(new Tab("read", "Reading"), new Tab("practice", "Practice"));
        Assertions.assertThat(ir.graphicsPaths()).containsExactly("figures/");
        Assertions.assertThat(ir.mathMacros())
            .containsEntry("\\R", "\\mathbb{R}")
            .containsEntry("\\N", "\\mathbb{N}");

        Assertions.assertThat(Documents.find(ir.root(), Node.Division.class))
            .extracting(Node::number)
            .containsExactly("1", "2", "2.1", "A");
        Assertions.assertThat(Documents.find(ir.root(), Node.Environment.class))
            .filteredOn(environment -> environment.kind() == EnvironmentKind.THEOREM_LIKE)
            .extracting(Node::number)
            .containsExactly("1.1", "1.2", "1.3", "2.1");
        Assertions.assertThat(Documents.find(ir.root(), Node.MathBlock.class))
            .extracting(math -> math.display() + " " + math.number())
            .containsExactly("true 1.1", "false null");
        Assertions.assertThat(Documents.only(ir.root(), Node.Figure.class).number()).isEqualTo("2.1");

        Assertions.assertThat(ir.labels().entries())
            .extracting(entry -> entry.key() + "=" + entry.number())
            .containsExactlyInAnyOrder(
                "ch:intro=1",
                "thm:first=1.1",
                "thm:second=1.2",
                "eq:energy=1.1",
                "sec:main=2.1",
                "thm:main=2.1",
                "fig:plot=2.1",
                "app:notation=A"
            );
        Assertions.assertThat(ir.labels().lookup("thm:main").origin().file()).isEqualTo("chapters/results.tex");
        Assertions.assertThat(Documents.find(ir.root(), Node.ResolvedLink.class))
            .extracting(Node.ResolvedLink::display)
            .containsExactly("1.2", "(1.1)", "1.1", "Theorem 1.2", "2.1", "[1]");

        Assertions.assertThat(Documents.only(ir.root(), Node.CodeBlock.class).text())
            .contains("\\begin{theorem} is only text here");
        Assertions.assertThat(ir.citations().size()).isEqualTo(2);
        Assertions.assertThat(ir.citations().lookup("knuth1984").title()).isEqualTo("The TeXbook");
        Assertions.assertThat(ir.citedKeys()).containsExactly("knuth1984");

        Assertions.assertThat(ir.warnings()).singleElement().satisfies(warning -> {
            Assertions.assertThat(warning.kind()).isEqualTo(DiagnosticKind.UNRESOLVED_REFERENCE);
            Assertions.assertThat(warning.origin()).isEqualTo(new SourceOrigin("chapters/results.tex", 15, 43));
        });
        Assertions.assertThat(Documents.only(ir.root(), Node.UnresolvedPlaceholder.class).key()).isEqualTo("nowhere");
    }

    @Test
    void producesIdenticalOutputOnEveryRun() throws Exception {
        final var first = DocumentIrWriter.toJson(convertSampleBook());
        final var second = DocumentIrWriter.toJson(convertSampleBook());
        Assertions.assertThat(second).isEqualTo(first);
    }

    @Test
    void writesTheDocumentAsJson(@TempDir final Path directory) throws Exception {
        final var output = directory.resolve("book.json");
        DocumentIrWriter.writeTo(convertSampleBook(), output);
        final var json = new ObjectMapper().readTree(Files.readString(output));
        Assertions.assertThat(json.get("format").asText()).isEqualTo("texweave-ir");
        Assertions.assertThat(json.get("metadata").get("title").asText()).isEqualTo("A Small Book, Configured");
        Assertions.assertThat(json.get("root").get("type").asText()).isEqualTo("document");
        Assertions.assertThat(json.get("labels").size()).isEqualTo(8);
        Assertions.assertThat(json.get("citedKeys").get(0).asText()).isEqualTo("knuth1984");
        Assertions.assertThat(json.get("warnings").get(0).get("kind").asText()).isEqualTo("UnresolvedReference");
        Assertions.assertThat(json.get("warnings").get(0).get("origin").asText())
            .isEqualTo("chapters/results.tex:15:43");
    }

    @Test
    void resolvesTheSecondOfThreeTheorems() {
        final var reader = new MemorySourceReader().with("main.tex", Documents.lines(
            "\\chapter{One}",
            "\\begin{theorem}A\\end{theorem}",
            "\\begin{theorem}\\label{second}B\\end{theorem}",
            "\\begin{theorem}C\\end{theorem}",
            "By \\ref{second}."
        ));
        final var ir = succeeded(convert(reader));
        Assertions.assertThat(Documents.find(ir.root(), Node.Environment.class))
            .extracting(Node::number)
            .containsExactly("1.1", "1.2", "1.3");
        Assertions.assertThat(Documents.only(ir.root(), Node.ResolvedLink.class).display()).isEqualTo("1.2");
        Assertions.assertThat(ir.warnings()).isEmpty();
    }

    @Test
    void citingAMissingKeyOnlyWarns() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "As in \\cite{present} and \\cite{missing}.\n\\bibliography{refs}\n")
            .with("refs.bib", "@book{present, title = {Here}}\n@book{unused, title = {Also here}}\n");
        final var ir = succeeded(convert(reader));
        Assertions.assertThat(ir.warnings())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNRESOLVED_REFERENCE);
        Assertions.assertThat(ir.citations().size()).isEqualTo(2);
        Assertions.assertThat(ir.citedKeys()).containsExactly("present");
        Assertions.assertThat(Documents.only(ir.root(), Node.UnresolvedPlaceholder.class).key()).isEqualTo("missing");
    }

    @Test
    void rejectsLabelsDeclaredInTwoFiles() {
        final var reader = new MemorySourceReader()
            .with("main.tex", "\\input{a}\n\\input{b}\n")
            .with("a.tex", "\\chapter{A}\\label{shared}\n")
            .with("b.tex", "\\chapter{B}\\label{shared}\n");
        final var failure = failed(convert(reader));
        Assertions.assertThat(failure.fatalDiagnostics()).singleElement().satisfies(diagnostic -> {
            Assertions.assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.DUPLICATE_LABEL);
            Assertions.assertThat(diagnostic.message()).contains("a.tex:1:");
            Assertions.assertThat(diagnostic.origin()).isNotNull();
            Assertions.assertThat(diagnostic.origin().file()).isEqualTo("b.tex");
        });
    }

    @Test
    void abortsOnStructuralErrors() {
        final var reader = new MemorySourceReader().with("main.tex", Documents.lines(
            "\\chapter{One}",
            "\\begin{theorem}",
            "\\section{Too deep}",
            "\\end{theorem}",
            "\\ref{nowhere}"
        ));
        final var failure = failed(convert(reader));
        Assertions.assertThat(failure.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNEXPECTED_SECTIONING_AT_DEPTH);
        Assertions.assertThat(failure.fatalDiagnostics().get(0).origin()).isEqualTo(new SourceOrigin("main.tex", 3, 1));
    }

    @Test
    void failsWhenTheMainFileIsMissing() {
        final var failure = failed(convert(new MemorySourceReader()));
        Assertions.assertThat(failure.diagnostics()).isNotEmpty();
        Assertions.assertThat(failure.fatalDiagnostics()).isNotEmpty();
    }

    private DocumentIr convertSampleBook() throws Exception {
        final var main = Path.of(Objects.requireNonNull(ConverterTest.class.getResource("/book/main.tex")).toURI());
        final var configuration = ConfigurationLoader.load(main.resolveSibling("config.json"));
        final var converter =
            new Converter(FileSystemSourceReader.instance(), pool, UnavailableDiagramRenderer.instance());
        return succeeded(converter.convert(main, configuration));
    }

    private ConversionResult convert(final MemorySourceReader reader) {
        final var converter = new Converter(reader, pool, UnavailableDiagramRenderer.instance());
        return converter.convert(Documents.mainFile, Configuration.defaults());
    }

    private static DocumentIr succeeded(final ConversionResult result) {
        Assertions.assertThat(result).isInstanceOf(ConversionResult.Success.class);
        return ((ConversionResult.Success) result).ir();
    }

    private static ConversionResult.Failure failed(final ConversionResult result) {
        Assertions.assertThat(result).isInstanceOf(ConversionResult.Failure.class);
        return (ConversionResult.Failure) result;
    }

    private ExecutorService pool;
}
