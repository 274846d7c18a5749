// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.bibliography.BibEntry;
import texweave.bibliography.BibliographyParser;
import texweave.bibliography.CitationRegistry;
import texweave.diagnostic.Diagnostic;
import texweave.diagnostic.DiagnosticCollector;
import texweave.diagnostic.DiagnosticKind;
import texweave.source.SourceFile;
import texweave.source.SourceOrigin;

final class BibliographyParserTest {
    @Test
    void readsEntriesAndCleansFields() {
        final var registry = parse(Documents.lines(
            "@Book{knuth1984,",
            "  Author = {Donald E. Knuth},",
            "  title = \"The {Art} of Programming, Volume 1\",",
            "  publisher = {Addison-Wesley},",
            "  year = 1984,",
            "  pages = {1--42},",
            "}"
        ));
        final var entry = registry.lookup("knuth1984");
        Assertions.assertThat(entry).isNotNull();
        Assertions.assertThat(entry.type()).isEqualTo("book");
        Assertions.assertThat(entry.author()).isEqualTo("Donald E. Knuth");
        Assertions.assertThat(entry.title()).isEqualTo("The Art of Programming, Volume 1");
        Assertions.assertThat(entry.year()).isEqualTo("1984");
        Assertions.assertThat(entry.venue()).isEqualTo("Addison-Wesley");
        Assertions.assertThat(entry.fields()).containsEntry("pages", "1–42");
        Assertions.assertThat(entry.origin()).isEqualTo(new SourceOrigin("refs.bib", 1, 1));
        Assertions.assertThat(entry.raw()).startsWith("@Book{knuth1984,").endsWith("}");
    }

    @Test
    void keepsNestedBracesAndCommasInsideValues() {
        final var registry = parse("@article{a, title = {On {A, B} and \"C\"}, journal = {J}}");
        Assertions.assertThat(registry.lookup("a").title()).isEqualTo("On A, B and \"C\"");
        Assertions.assertThat(registry.lookup("a").venue()).isEqualTo("J");
    }

    @Test
    void convertsAccents() {
        final var registry = parse("@misc{g, author = {Kurt G{\\\"o}del and Paul Erd\\H{o}s}}");
        Assertions.assertThat(registry.lookup("g").author()).startsWith("Kurt Gödel and Paul Erd");
    }

    @Test
    void expandsStringMacrosAndConcatenation() {
        final var registry = parse(Documents.lines(
            "@string{acm = \"ACM Press\"}",
            "@inproceedings{p, publisher = acm # { Books}, month = jan}"
        ));
        Assertions.assertThat(registry.lookup("p").fields())
            .containsEntry("publisher", "ACM Press Books")
            .containsEntry("month", "January");
    }

    @Test
    void acceptsParenthesesAndSkipsComments() {
        final var registry = parse(Documents.lines(
            "Stray text with an email@example.com address.",
            "@comment{ignored, title = {no}}",
            "@preamble{\"\\newcommand{\\x}{y}\"}",
            "@book(paren, title = {Round})"
        ));
        Assertions.assertThat(registry.entries()).extracting(BibEntry::key).containsExactly("paren");
        Assertions.assertThat(registry.lookup("paren").title()).isEqualTo("Round");
    }

    @Test
    void laterDuplicatesWin() {
        final var collected = DiagnosticCollector.collect(() -> parse(Documents.lines(
            "@book{dup, title = {First}}",
            "@book{dup, title = {Second}}"
        )));
        Assertions.assertThat(collected.value().lookup("dup").title()).isEqualTo("Second");
        Assertions.assertThat(collected.warnings()).singleElement().satisfies(diagnostic -> {
            Assertions.assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.DUPLICATE_CITATION_KEY);
            Assertions.assertThat(diagnostic.origin()).isEqualTo(new SourceOrigin("refs.bib", 2, 1));
        });
    }

    @Test
    void skipsEntriesWithoutKeys() {
        final var collected = DiagnosticCollector.collect(() -> parse("@book{title = {Anonymous}}\n@book{ok}"));
        Assertions.assertThat(collected.value().entries()).extracting(BibEntry::key).containsExactly("ok");
        Assertions.assertThat(collected.warnings())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.MALFORMED_BIBLIOGRAPHY_ENTRY);
    }

    @Test
    void keepsFieldsBeforeAMalformedOne() {
        final var collected = DiagnosticCollector.collect(() -> parse("@book{k, title = {Kept}, year 1999}"));
        Assertions.assertThat(collected.value().lookup("k").title()).isEqualTo("Kept");
        Assertions.assertThat(collected.value().lookup("k").year()).isNull();
        Assertions.assertThat(collected.warnings())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.MALFORMED_BIBLIOGRAPHY_ENTRY);
    }

    @Test
    void rejectsUnclosedEntries() {
        final var collected = DiagnosticCollector.collect(() -> parse("@book{open, title = {Never closed}"));
        Assertions.assertThat(collected.isAborted()).isTrue();
        Assertions.assertThat(collected.fatalDiagnostics())
            .extracting(Diagnostic::kind)
            .containsExactly(DiagnosticKind.UNMATCHED_BIBLIOGRAPHY_BRACE);
    }

    @Test
    void mergesSeveralDatabases() {
        final var registry = BibliographyParser.parse(List.of(
            SourceFile.of(MemorySourceReader.root.resolve("a.bib"), "a.bib", "@book{a, title = {A}}"),
            SourceFile.of(MemorySourceReader.root.resolve("b.bib"), "b.bib", "@book{b, title = {B}}")
        ));
        Assertions.assertThat(registry.size()).isEqualTo(2);
        Assertions.assertThat(registry.lookup("b").origin().file()).isEqualTo("b.bib");
    }

    private static CitationRegistry parse(final String text) {
        return BibliographyParser.parse(List.of(SourceFile.of(MemorySourceReader.root.resolve("refs.bib"), "refs.bib",
            text)));
    }
}
