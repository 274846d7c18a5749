// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.ir;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.config.EnvironmentStyle;
import texweave.diagnostic.Diagnostic;
import texweave.document.DiagramRendering;
import texweave.document.Node;
import texweave.source.SourceOrigin;
import texweave.util.Trace;
import texweave.util.UnreachableCodeReachedError;
import texweave.util.annotation.Nullable;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.exception.IOExceptionCondition;

/**
 * Serializes a {@link DocumentIr} to JSON.
 * <p>
 * The output is deterministic: objects have a fixed field order, maps are written sorted by key, nodes in document
 * order, and origins as {@code file:line:column} with paths relative to the project root. Converting the same input
 * with the same configuration twice yields byte-identical output.
 */
public final class DocumentIrWriter {
    private DocumentIrWriter(final JsonGenerator generator) {
        this.generator = generator;
    }

    /**
     * Writes {@code ir} to {@code path} as UTF-8.
     * <p>
     * If an I/O error occurs, a fatal {@link IOExceptionCondition} is signaled.
     */
    public static void writeTo(final DocumentIr ir, final Path path) {
        try (final var trace = new Trace(() -> "Writing the document IR to " + path)) {
            trace.use();
            try (final var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(ir, writer);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            logger.info("Wrote the document IR to {}", path);
        }
    }

    /**
     * Returns the JSON form of {@code ir}.
     */
    public static String toJson(final DocumentIr ir) {
        final var writer = new StringWriter();
        try {
            write(ir, writer);
        } catch (final IOException e) {
            // StringWriter never fails.
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * Writes the JSON form of {@code ir} to {@code writer}, leaving it open.
     */
    public static void write(final DocumentIr ir, final Writer writer) throws IOException {
        final var printer = new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n"));
        try (final var generator = mapper.getFactory().createGenerator(writer)) {
            generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            generator.setPrettyPrinter(printer);
            new DocumentIrWriter(generator).document(ir);
            generator.writeRaw('\n');
        }
    }

    private void document(final DocumentIr ir) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("format", "texweave-ir");
        generator.writeNumberField("version", formatVersion);
        metadata(ir);
        generator.writeArrayFieldStart("tabs");
        for (final var tab : ir.tabs()) {
            generator.writeStartObject();
            generator.writeStringField("id", tab.id());
            generator.writeStringField("label", tab.label());
            generator.writeEndObject();
        }
        generator.writeEndArray();
        generator.writeObjectFieldStart("environments");
        for (final var entry : ir.environments().entries().entrySet()) {
            generator.writeFieldName(entry.getKey());
            environment(entry.getValue());
        }
        generator.writeEndObject();
        generator.writeObjectFieldStart("mathMacros");
        for (final var entry : ir.mathMacros().entrySet()) {
            generator.writeStringField(entry.getKey(), entry.getValue());
        }
        generator.writeEndObject();
        generator.writeArrayFieldStart("graphicsPaths");
        for (final var path : ir.graphicsPaths()) {
            generator.writeString(path);
        }
        generator.writeEndArray();
        generator.writeFieldName("root");
        node(ir.root());
        labels(ir);
        citations(ir);
        generator.writeArrayFieldStart("warnings");
        for (final var warning : ir.warnings()) {
            diagnostic(warning);
        }
        generator.writeEndArray();
        generator.writeEndObject();
    }

    private void metadata(final DocumentIr ir) throws IOException {
        final var metadata = ir.metadata();
        generator.writeObjectFieldStart("metadata");
        nullableString("title", metadata.title());
        nullableString("subtitle", metadata.subtitle());
        nullableString("author", metadata.author());
        nullableString("version", metadata.version());
        nullableString("date", metadata.date());
        nullableString("language", metadata.language());
        generator.writeEndObject();
    }

    private void environment(final EnvironmentStyle style) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("kind", lowerCase(style.kind().name()));
        generator.writeStringField("cssClass", style.cssClass());
        generator.writeStringField("displayLabel", style.displayLabel());
        generator.writeStringField("counter", style.counter());
        generator.writeStringField("numbering", lowerCase(style.numbering().name()));
        generator.writeStringField("reset", lowerCase(style.reset().name()));
        generator.writeEndObject();
    }

    private void labels(final DocumentIr ir) throws IOException {
        generator.writeArrayFieldStart("labels");
        for (final var label : ir.labels().entries()) {
            generator.writeStartObject();
            generator.writeStringField("key", label.key());
            generator.writeStringField("target", label.target().toString());
            nullableString("number", label.number());
            generator.writeStringField("kind", label.kind());
            generator.writeStringField("displayLabel", label.displayLabel());
            generator.writeStringField("title", label.title());
            generator.writeStringField("origin", label.origin().toString());
            generator.writeEndObject();
        }
        generator.writeEndArray();
    }

    private void citations(final DocumentIr ir) throws IOException {
        generator.writeArrayFieldStart("citations");
        for (final var entry : ir.citations().entries()) {
            generator.writeStartObject();
            generator.writeStringField("key", entry.key());
            generator.writeStringField("type", entry.type());
            nullableString("author", entry.author());
            nullableString("title", entry.title());
            nullableString("year", entry.year());
            nullableString("venue", entry.venue());
            generator.writeObjectFieldStart("fields");
            for (final var field : entry.fields().entrySet()) {
                generator.writeStringField(field.getKey(), field.getValue());
            }
            generator.writeEndObject();
            generator.writeStringField("raw", entry.raw());
            generator.writeStringField("origin", entry.origin().toString());
            generator.writeEndObject();
        }
        generator.writeEndArray();
        generator.writeArrayFieldStart("citedKeys");
        for (final var key : ir.citedKeys()) {
            generator.writeString(key);
        }
        generator.writeEndArray();
    }

    private void diagnostic(final Diagnostic diagnostic) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("severity", lowerCase(diagnostic.severity().name()));
        generator.writeStringField("kind", diagnostic.kind().displayName());
        generator.writeStringField("message", diagnostic.message());
        final SourceOrigin origin = diagnostic.origin();
        nullableString("origin", (origin == null) ? null : origin.toString());
        generator.writeEndObject();
    }

    private void node(final Node node) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("type", typeName(node));
        generator.writeStringField("id", node.id().toString());
        generator.writeStringField("span", node.span().toString());
        fields(node);
        if (!node.children().isEmpty()) {
            nodes("children", node.children());
        }
        generator.writeEndObject();
    }

    private void nodes(final String name, final List<Node> nodes) throws IOException {
        generator.writeArrayFieldStart(name);
        for (final var node : nodes) {
            node(node);
        }
        generator.writeEndArray();
    }

    private void fields(final Node node) throws IOException {
        if (node instanceof final Node.Division division) {
            generator.writeStringField("level", division.level().commandName());
            generator.writeBooleanField("numbered", division.numbered());
            generator.writeBooleanField("appendix", division.appendix());
            nullableString("number", division.number());
            nodes("title", division.title());
        } else if (node instanceof final Node.Environment environment) {
            generator.writeStringField("name", environment.name());
            generator.writeStringField("kind", lowerCase(environment.kind().name()));
            nullableString("number", environment.number());
            nodes("title", environment.title());
        } else if (node instanceof final Node.ListItem item) {
            nodes("label", item.label());
        } else if (node instanceof final Node.MathBlock math) {
            generator.writeBooleanField("display", math.display());
            nullableString("environment", math.environment());
            generator.writeStringField("source", math.source());
            nullableString("number", math.number());
        } else if (node instanceof final Node.Table table) {
            generator.writeBooleanField("floating", table.floating());
            nullableString("number", table.number());
        } else if (node instanceof final Node.Tabular tabular) {
            generator.writeStringField("environment", tabular.environment());
            generator.writeStringField("columnSpec", tabular.columnSpec());
        } else if (node instanceof final Node.TableCell cell) {
            generator.writeNumberField("columnSpan", cell.columnSpan());
        } else if (node instanceof final Node.Figure figure) {
            generator.writeStringField("environment", figure.environment());
            nullableString("number", figure.number());
        } else if (node instanceof final Node.Algorithm algorithm) {
            generator.writeStringField("environment", algorithm.environment());
            nullableString("number", algorithm.number());
        } else if (node instanceof final Node.Pseudocode pseudocode) {
            generator.writeStringField("environment", pseudocode.environment());
            generator.writeArrayFieldStart("lines");
            for (final var line : pseudocode.lines()) {
                generator.writeStartObject();
                generator.writeNumberField("depth", line.depth());
                generator.writeStringField("keyword", line.keyword());
                generator.writeStringField("text", line.text());
                generator.writeStringField("trailer", line.trailer());
                nullableString("comment", line.comment());
                generator.writeEndObject();
            }
            generator.writeEndArray();
        } else if (node instanceof final Node.Image image) {
            generator.writeStringField("path", image.path());
            generator.writeStringField("options", image.options());
        } else if (node instanceof final Node.CodeBlock code) {
            generator.writeStringField("environment", code.environment());
            nullableString("language", code.language());
            generator.writeStringField("text", code.text());
            generator.writeBooleanField("lineNumbers", code.lineNumbers());
            generator.writeBooleanField("inline", code.inline());
            nullableString("caption", code.caption());
            nullableString("number", code.number());
        } else if (node instanceof final Node.DiagramBlock diagram) {
            generator.writeStringField("environment", diagram.environment());
            generator.writeStringField("source", diagram.source());
            diagramRendering(diagram.rendering());
        } else if (node instanceof final Node.Formatting formatting) {
            generator.writeStringField("style", lowerCase(formatting.style().name()));
        } else if (node instanceof final Node.CrossRef reference) {
            generator.writeStringField("key", reference.key());
            generator.writeStringField("kind", lowerCase(reference.kind().name()));
        } else if (node instanceof final Node.ResolvedLink link) {
            generator.writeStringField("key", link.key());
            generator.writeStringField("kind", lowerCase(link.kind().name()));
            generator.writeStringField("display", link.display());
            generator.writeStringField("target", link.target());
        } else if (node instanceof final Node.UnresolvedPlaceholder placeholder) {
            generator.writeStringField("key", placeholder.key());
            generator.writeStringField("kind", lowerCase(placeholder.kind().name()));
        } else if (node instanceof final Node.Label label) {
            generator.writeStringField("key", label.key());
            generator.writeStringField("target", label.target().toString());
        } else if (node instanceof final Node.Footnote footnote) {
            nullableString("number", footnote.number());
        } else if (node instanceof final Node.Hyperlink hyperlink) {
            generator.writeStringField("url", hyperlink.url());
        } else if (node instanceof final Node.Text text) {
            generator.writeStringField("text", text.text());
        }
    }

    private void diagramRendering(final DiagramRendering rendering) throws IOException {
        if (rendering instanceof final DiagramRendering.Rendered rendered) {
            generator.writeStringField("rendering", "rendered");
            generator.writeStringField("image", rendered.imagePath());
        } else if (rendering instanceof final DiagramRendering.Unavailable unavailable) {
            generator.writeStringField("rendering", "unavailable");
            generator.writeBooleanField("rendererUnavailable", true);
            generator.writeStringField("reason", unavailable.reason());
        } else {
            generator.writeStringField("rendering", "pending");
        }
    }

    private void nullableString(final String name, final @Nullable String value) throws IOException {
        if (value == null) {
            generator.writeNullField(name);
        } else {
            generator.writeStringField(name, value);
        }
    }

    private static String typeName(final Node node) {
        if (node instanceof Node.DocumentRoot) {
            return "document";
        } else if (node instanceof Node.Division) {
            return "division";
        } else if (node instanceof Node.Paragraph) {
            return "paragraph";
        } else if (node instanceof Node.Environment) {
            return "environment";
        } else if (node instanceof Node.ListItem) {
            return "listItem";
        } else if (node instanceof Node.MathBlock) {
            return "math";
        } else if (node instanceof Node.Table) {
            return "table";
        } else if (node instanceof Node.Tabular) {
            return "tabular";
        } else if (node instanceof Node.TableRow) {
            return "tableRow";
        } else if (node instanceof Node.TableCell) {
            return "tableCell";
        } else if (node instanceof Node.Figure) {
            return "figure";
        } else if (node instanceof Node.Algorithm) {
            return "algorithm";
        } else if (node instanceof Node.Pseudocode) {
            return "pseudocode";
        } else if (node instanceof Node.Image) {
            return "image";
        } else if (node instanceof Node.Caption) {
            return "caption";
        } else if (node instanceof Node.CodeBlock) {
            return "code";
        } else if (node instanceof Node.DiagramBlock) {
            return "diagram";
        } else if (node instanceof Node.Formatting) {
            return "formatting";
        } else if (node instanceof Node.CrossRef) {
            return "crossRef";
        } else if (node instanceof Node.ResolvedLink) {
            return "link";
        } else if (node instanceof Node.UnresolvedPlaceholder) {
            return "unresolved";
        } else if (node instanceof Node.Label) {
            return "label";
        } else if (node instanceof Node.Footnote) {
            return "footnote";
        } else if (node instanceof Node.Hyperlink) {
            return "hyperlink";
        } else if (node instanceof Node.LineBreak) {
            return "lineBreak";
        } else if (node instanceof Node.Text) {
            return "text";
        }
        throw new UnreachableCodeReachedError("Unknown node type " + node.getClass());
    }

    private static String lowerCase(final String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static final Logger logger = LoggerFactory.getLogger(DocumentIrWriter.class);

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final int formatVersion = 1;

    private final JsonGenerator generator;
}
