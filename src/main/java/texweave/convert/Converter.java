// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.convert;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.bibliography.BibliographyParser;
import texweave.bibliography.CitationRegistry;
import texweave.config.Configuration;
import texweave.config.EnvironmentTable;
import texweave.diagnostic.DiagnosticCollector;
import texweave.diagram.DiagramRenderer;
import texweave.diagram.DiagramStage;
import texweave.document.Node;
import texweave.document.NodeIdGenerator;
import texweave.ir.DocumentIr;
import texweave.numbering.NumberingEngine;
import texweave.numbering.NumberingPlan;
import texweave.parse.DocumentBoundary;
import texweave.parse.Parser;
import texweave.parse.Preamble;
import texweave.parse.PreambleReader;
import texweave.resolve.Resolver;
import texweave.source.SourceLoader;
import texweave.source.SourceReader;
import texweave.util.CollectionExecutorService;
import texweave.util.Trace;

/**
 * The entry point to the conversion pipeline.
 * <p>
 * A conversion runs these stages, each consuming the immutable output of the previous ones:
 * <ul>
 * <li>loading the project, with every inclusion expanded;
 * <li>reading the preamble;
 * <li>parsing the body, concurrently with parsing the bibliography;
 * <li>numbering;
 * <li>resolving labels, references and citations;
 * <li>rendering diagrams, concurrently.
 * </ul>
 * <p>
 * Every diagnostic is collected. The first fatal one abandons the conversion, so no partial IR is ever produced.
 */
public final class Converter {
    /**
     * Initializes a converter reading sources through {@code reader}, running parallel work on
     * {@code executorService} and rendering diagrams with {@code diagramRenderer}.
     */
    public Converter(
        final SourceReader reader,
        final ExecutorService executorService,
        final DiagramRenderer diagramRenderer
    ) {
        this.reader = reader;
        executor = new CollectionExecutorService(executorService);
        this.diagramRenderer = diagramRenderer;
    }

    /**
     * Converts the project whose main file is {@code rootFile}.
     * <p>
     * Diagnostics never escape as conditions; they are returned in the result. Conditions that are not diagnostics,
     * such as I/O failures outside the source loader, are left to the caller's handlers.
     */
    public ConversionResult convert(final Path rootFile, final Configuration configuration) {
        try (final var trace = new Trace(() -> "Converting " + rootFile)) {
            trace.use();
            final var collected = DiagnosticCollector.collect(() -> run(rootFile, configuration));
            final var ir = collected.value();
            if (ir == null) {
                logger.info("Conversion failed with {} diagnostic(s)", collected.diagnostics().size());
                return new ConversionResult.Failure(collected.diagnostics());
            }
            logger.info("Conversion succeeded with {} warning(s)", collected.warnings().size());
            return new ConversionResult.Success(ir.withWarnings(collected.warnings()));
        }
    }

    private DocumentIr run(final Path rootFile, final Configuration configuration) {
        final var source =
            SourceLoader.load(reader, rootFile, configuration.searchPath(), configuration.bibliography());
        final var bodyStart = DocumentBoundary.bodyStart(source);
        final Preamble preamble;
        try (final var trace = new Trace("Reading the preamble")) {
            trace.use();
            preamble = (bodyStart > 0) ? PreambleReader.read(source, 0, bodyStart) : Preamble.empty;
        }
        final var metadata = preamble.metadata().overriddenBy(configuration.metadata());
        final var language = (metadata.language() != null) ? metadata.language() : configuration.language();
        final var environments = EnvironmentTable.of(language, preamble.environments(), configuration.environments());
        final var topLevel = preamble.topLevel();

        // The bibliography does not depend on the tree, so both are built at the same time.
        final var ids = new NodeIdGenerator();
        final var results = executor.map(List.<Supplier<Object>>of(
            () -> BibliographyParser.parse(source.bibliographyFiles()),
            () -> Parser.parse(source, bodyStart, source.length(), environments, topLevel, ids)
        ), Supplier::get);
        final var citations = (CitationRegistry) results.get(0);
        final var tree = (Node.DocumentRoot) results.get(1);

        final var plan = NumberingPlan.of(configuration, preamble.counterRules(), environments, topLevel);
        final var numbered = NumberingEngine.number(tree, plan);
        final var resolution = Resolver.resolve(numbered, environments, citations, configuration.citationStyle());
        final var rendered = DiagramStage.render(resolution.root(), preamble.diagramSetup(), diagramRenderer, executor);

        final var mathMacros = new TreeMap<>(preamble.mathMacros());
        mathMacros.putAll(configuration.mathMacros());
        return new DocumentIr(
            metadata,
            rendered,
            resolution.labels(),
            citations,
            resolution.citedKeys(),
            mathMacros,
            configuration.tabs(),
            environments,
            preamble.graphicsPaths(),
            List.of()
        );
    }

    private static final Logger logger = LoggerFactory.getLogger(Converter.class);

    private final SourceReader reader;
    private final CollectionExecutorService executor;
    private final DiagramRenderer diagramRenderer;
}
