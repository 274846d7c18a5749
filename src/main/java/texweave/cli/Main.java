// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import texweave.config.Configuration;
import texweave.config.ConfigurationLoader;
import texweave.convert.ConversionResult;
import texweave.convert.Converter;
import texweave.diagnostic.Diagnostic;
import texweave.diagram.DiagramRenderer;
import texweave.diagram.ExternalDiagramRenderer;
import texweave.diagram.UnavailableDiagramRenderer;
import texweave.ir.DocumentIrWriter;
import texweave.source.FileSystemSourceReader;
import texweave.util.SneakyThrow;
import texweave.util.annotation.Nullable;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.Handler;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        if (args.length != 2 && args.length != 3) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Usage: texweave <main.tex> <output.json> [<config.json>]");
                return ExitCode.USAGE;
            }
        }
        final var mainFile = Path.of(args[0]);
        final var outputFile = Path.of(args[1]);
        final var configurationFile = (args.length == 3) ? Path.of(args[2]) : null;

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var threadPool = createThreadPool();
            try {
                final var exitCode = ConditionContext.withRestart(FallbackHandler.abortProcess, restart ->
                    convert(threadPool, mainFile, outputFile, configurationFile));
                return (exitCode != null) ? exitCode : ExitCode.ERROR;
            } finally {
                shutDownThreadPool(threadPool);
            }
        }
    }

    private static ExitCode convert(
        final ExecutorService executorService,
        final Path mainFile,
        final Path outputFile,
        final @Nullable Path configurationFile
    ) {
        final var configuration = (configurationFile != null)
            ? ConfigurationLoader.load(configurationFile)
            : Configuration.defaults();
        final var converter =
            new Converter(FileSystemSourceReader.instance(), executorService, diagramRenderer(outputFile));
        final var result = converter.convert(mainFile, configuration);
        report(result.diagnostics());
        if (result instanceof final ConversionResult.Success success) {
            DocumentIrWriter.writeTo(success.ir(), outputFile);
            return ExitCode.SUCCESS;
        }
        return ExitCode.ERROR;
    }

    // Rendered diagrams go to an images directory next to the output.
    private static DiagramRenderer diagramRenderer(final Path outputFile) {
        final var parent = outputFile.toAbsolutePath().getParent();
        final var imageDirectory =
            (parent == null) ? Path.of(imagesDirectoryName) : parent.resolve(imagesDirectoryName);
        final var renderer = ExternalDiagramRenderer.detect(imageDirectory, imagesDirectoryName);
        return (renderer != null) ? renderer : UnavailableDiagramRenderer.instance();
    }

    private static void report(final List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        final var fatalCount = diagnostics.stream().filter(Diagnostic::isFatal).count();
        try (final var streams = Streams.acquire()) {
            final var err = streams.err();
            for (final var diagnostic : diagnostics) {
                err.println(diagnostic);
            }
            err.println(diagnostics.size() - fatalCount + " warning(s), " + fatalCount + " fatal error(s)");
        }
    }

    private static ThreadPoolExecutor createThreadPool() {
        final var threadId = new AtomicInteger(0);
        return new ThreadPoolExecutor(
            Runtime.getRuntime().availableProcessors(),
            Integer.MAX_VALUE,
            0,
            TimeUnit.NANOSECONDS,
            new LinkedBlockingQueue<>(),
            runnable -> new Thread(runnable, "worker-thread-" + threadId.addAndGet(1))
        );
    }

    @SuppressWarnings("ResultOfMethodCallIgnored")
    private static void shutDownThreadPool(final ThreadPoolExecutor threadPool) {
        threadPool.shutdownNow();
        try {
            threadPool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    private static final String imagesDirectoryName = "images";

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
