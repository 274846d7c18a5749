// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagram;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.util.SneakyThrow;
import texweave.util.Trace;
import texweave.util.annotation.Nullable;
import texweave.util.condition.ConditionContext;

/**
 * Renders diagrams with an external TeX engine and {@code pdftoppm}.
 * <p>
 * Each diagram is wrapped in a {@code standalone} document carrying the document's own TikZ declarations, compiled
 * to PDF in a private temporary directory, then rasterized to PNG and copied into the image directory. A document
 * that loads no TikZ libraries gets a common default set. Every call uses its own directory and processes, so calls
 * may run concurrently.
 */
public final class ExternalDiagramRenderer implements DiagramRenderer {
    /**
     * @param engine         The TeX engine executable, such as {@code xelatex}.
     * @param rasterizer     The {@code pdftoppm} executable.
     * @param imageDirectory The directory rendered images are written to.
     * @param imagePrefix    The path of {@code imageDirectory} relative to the output document.
     */
    public ExternalDiagramRenderer(
        final Path engine,
        final Path rasterizer,
        final Path imageDirectory,
        final String imagePrefix
    ) {
        this.engine = engine;
        this.rasterizer = rasterizer;
        this.imageDirectory = imageDirectory;
        this.imagePrefix = imagePrefix;
    }

    /**
     * Looks for {@code xelatex}, then {@code pdflatex}, and for {@code pdftoppm} on the {@code PATH}.
     *
     * @return A renderer using the tools found, or {@code null} if either tool is missing.
     */
    public static @Nullable ExternalDiagramRenderer detect(final Path imageDirectory, final String imagePrefix) {
        var engine = findExecutable("xelatex");
        if (engine == null) {
            engine = findExecutable("pdflatex");
        }
        final var rasterizer = findExecutable("pdftoppm");
        if (engine == null || rasterizer == null) {
            logger.info("No TeX engine or pdftoppm found; diagrams will keep their source");
            return null;
        }
        logger.info("Rendering diagrams with {} and {}", engine, rasterizer);
        return new ExternalDiagramRenderer(engine, rasterizer, imageDirectory, imagePrefix);
    }

    @Override
    public String render(final DiagramRequest request) throws DiagramRenderingException {
        try (final var trace = new Trace(() -> "Rendering diagram " + request.name())) {
            trace.use();
            final Path workDirectory;
            try {
                workDirectory = Files.createTempDirectory("texweave-diagram-");
            } catch (final IOException e) {
                throw new DiagramRenderingException("cannot create a working directory: " + e.getMessage(), e);
            }
            try {
                return renderIn(workDirectory, request);
            } catch (final IOException e) {
                throw new DiagramRenderingException(String.valueOf(e.getMessage()), e);
            } finally {
                ConditionContext.withSuppressedExceptions(() -> deleteRecursively(workDirectory));
            }
        }
    }

    private String renderIn(final Path workDirectory, final DiagramRequest request)
        throws IOException, DiagramRenderingException {
        Files.writeString(workDirectory.resolve("diagram.tex"), standaloneDocument(request), StandardCharsets.UTF_8);
        run(workDirectory, engineTimeout, List.of(
            engine.toString(),
            "-interaction=nonstopmode",
            "-halt-on-error",
            "diagram.tex"
        ));
        if (!Files.isRegularFile(workDirectory.resolve("diagram.pdf"))) {
            throw new DiagramRenderingException(engine.getFileName() + " produced no PDF");
        }
        run(workDirectory, rasterizerTimeout, List.of(
            rasterizer.toString(),
            "-png",
            "-r",
            "200",
            "-singlefile",
            "diagram.pdf",
            "diagram"
        ));
        final var image = workDirectory.resolve("diagram.png");
        if (!Files.isRegularFile(image)) {
            throw new DiagramRenderingException(rasterizer.getFileName() + " produced no image");
        }
        Files.createDirectories(imageDirectory);
        final var fileName = request.name() + ".png";
        Files.copy(image, imageDirectory.resolve(fileName), StandardCopyOption.REPLACE_EXISTING);
        logger.debug("Rendered diagram {} to {}", request.name(), fileName);
        return imagePrefix.isEmpty() ? fileName : (imagePrefix + "/" + fileName);
    }

    private static void run(final Path workDirectory, final Duration timeout, final List<String> command)
        throws IOException, DiagramRenderingException {
        final var log = workDirectory.resolve("process.log");
        final var builder = new ProcessBuilder(command)
            .directory(workDirectory.toFile())
            .redirectErrorStream(true)
            .redirectOutput(log.toFile());
        final var process = builder.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DiagramRenderingException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            throw SneakyThrow.doThrow(e);
        }
        if (process.exitValue() != 0) {
            throw new DiagramRenderingException(
                command.get(0) + " exited with status " + process.exitValue() + ": " + tailOf(log)
            );
        }
    }

    private static String tailOf(final Path log) throws IOException {
        final var output = Files.readString(log, StandardCharsets.UTF_8).strip();
        return (output.length() <= 300) ? output : output.substring(output.length() - 300);
    }

    /**
     * Returns the LaTeX document compiled for a request.
     */
    public static String standaloneDocument(final DiagramRequest request) {
        final var builder = new StringBuilder()
            .append("\\documentclass[border=5pt]{standalone}\n")
            .append("\\usepackage{tikz}\n")
            .append("\\usepackage{tikz-cd}\n")
            .append("\\usepackage{amsmath,amssymb}\n");
        if (request.setup().stream().noneMatch(line -> line.startsWith("\\usetikzlibrary"))) {
            builder.append(defaultLibraries).append('\n');
        }
        for (final var line : request.setup()) {
            builder.append(line).append('\n');
        }
        return builder
            .append("\\begin{document}\n")
            .append(request.source()).append('\n')
            .append("\\end{document}\n")
            .toString();
    }

    private static void deleteRecursively(final Path directory) throws IOException {
        final List<Path> paths;
        try (final var stream = Files.walk(directory)) {
            paths = stream.sorted(Comparator.reverseOrder()).toList();
        }
        for (final var path : paths) {
            Files.deleteIfExists(path);
        }
    }

    private static @Nullable Path findExecutable(final String name) {
        final var pathVariable = System.getenv("PATH");
        if (pathVariable == null) {
            return null;
        }
        for (final var directory : pathVariable.split(File.pathSeparator)) {
            if (directory.isEmpty()) {
                continue;
            }
            final var candidate = Path.of(directory, name);
            if (Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static final Logger logger = LoggerFactory.getLogger(ExternalDiagramRenderer.class);

    private static final String defaultLibraries = "\\usetikzlibrary{arrows,arrows.meta,shapes,shapes.geometric,"
        + "positioning,calc,decorations.pathreplacing,fit,backgrounds,matrix,patterns}";

    private static final Duration engineTimeout = Duration.ofSeconds(30);
    private static final Duration rasterizerTimeout = Duration.ofSeconds(10);

    private final Path engine;
    private final Path rasterizer;
    private final Path imageDirectory;
    private final String imagePrefix;
}
