// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.document;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import java.util.List;
import texweave.source.SourceSpan;
import texweave.util.annotation.Nullable;

/**
 * A node of the document tree.
 * <p>
 * Nodes are immutable and every node except the root is owned by exactly one parent. Stages after the parser never
 * modify a tree; they build a new one with {@link #withChildren(List)} and {@link #withNumber(String)}.
 */
public sealed interface Node {
    /**
     * Returns the node's identifier, unique within one conversion.
     */
    NodeId id();

    /**
     * Returns the node's extent in the original sources.
     */
    SourceSpan span();

    /**
     * Returns the node's children in document order. Leaves have none.
     */
    default List<Node> children() {
        return List.of();
    }

    /**
     * Returns a copy of this node with the given children. Leaves only accept an empty list.
     */
    @CheckReturnValue
    default Node withChildren(final List<Node> children) {
        assert children.isEmpty() : getClass().getSimpleName() + " cannot have children";
        return this;
    }

    /**
     * Returns the number assigned by the numbering engine, or {@code null} for unnumbered nodes.
     */
    default @Nullable String number() {
        return null;
    }

    /**
     * Returns a copy of this node carrying {@code number}. Only numberable nodes accept a number.
     */
    @CheckReturnValue
    default Node withNumber(final String number) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " cannot be numbered");
    }

    /**
     * The root of the document tree.
     */
    record DocumentRoot(NodeId id, SourceSpan span, List<Node> children) implements Node {
        public DocumentRoot {
            children = List.copyOf(children);
        }

        @Override
        public DocumentRoot withChildren(final List<Node> children) {
            return new DocumentRoot(id, span, children);
        }
    }

    /**
     * A sectioning unit: part, chapter, section, subsection or subsubsection.
     *
     * @param numbered Whether the division takes part in numbering; false for starred and front or back matter
     *                 divisions.
     * @param appendix Whether the division follows {@code \appendix}.
     * @param title    The inline content of the title.
     */
    record Division(
        NodeId id,
        SourceSpan span,
        DivisionLevel level,
        boolean numbered,
        boolean appendix,
        List<Node> title,
        @Nullable String number,
        List<Node> children
    ) implements Node {
        public Division {
            title = List.copyOf(title);
            children = List.copyOf(children);
        }

        @Override
        public Division withChildren(final List<Node> children) {
            return new Division(id, span, level, numbered, appendix, title, number, children);
        }

        @Override
        public Division withNumber(final String number) {
            return new Division(id, span, level, numbered, appendix, title, number, children);
        }
    }

    /**
     * A run of inline content.
     */
    record Paragraph(NodeId id, SourceSpan span, List<Node> children) implements Node {
        public Paragraph {
            children = List.copyOf(children);
        }

        @Override
        public Paragraph withChildren(final List<Node> children) {
            return new Paragraph(id, span, children);
        }
    }

    /**
     * A {@code \begin{name}...\end{name}} block that is not a float, a grid, math or verbatim.
     *
     * @param title The inline content of the optional argument, such as a theorem's name.
     */
    record Environment(
        NodeId id,
        SourceSpan span,
        String name,
        EnvironmentKind kind,
        List<Node> title,
        @Nullable String number,
        List<Node> children
    ) implements Node {
        public Environment {
            title = List.copyOf(title);
            children = List.copyOf(children);
        }

        @Override
        public Environment withChildren(final List<Node> children) {
            return new Environment(id, span, name, kind, title, number, children);
        }

        @Override
        public Environment withNumber(final String number) {
            return new Environment(id, span, name, kind, title, number, children);
        }
    }

    /**
     * An {@code \item} of a list environment.
     *
     * @param label The inline content of the optional {@code [label]}, empty if absent.
     */
    record ListItem(NodeId id, SourceSpan span, List<Node> label, List<Node> children) implements Node {
        public ListItem {
            label = List.copyOf(label);
            children = List.copyOf(children);
        }

        @Override
        public ListItem withChildren(final List<Node> children) {
            return new ListItem(id, span, label, children);
        }
    }

    /**
     * Math, kept as opaque source for the renderer.
     *
     * @param environment The math environment, or {@code null} for delimiter-based math.
     */
    record MathBlock(
        NodeId id,
        SourceSpan span,
        boolean display,
        @Nullable String environment,
        String source,
        @Nullable String number
    ) implements Node {
        @Override
        public MathBlock withNumber(final String number) {
            return new MathBlock(id, span, display, environment, source, number);
        }
    }

    /**
     * A table float. Its children include its caption, its labels and its grids.
     */
    record Table(NodeId id, SourceSpan span, boolean floating, @Nullable String number, List<Node> children)
        implements Node {
        public Table {
            children = List.copyOf(children);
        }

        @Override
        public Table withChildren(final List<Node> children) {
            return new Table(id, span, floating, number, children);
        }

        @Override
        public Table withNumber(final String number) {
            return new Table(id, span, floating, number, children);
        }
    }

    /**
     * A {@code tabular}-like grid; its children are {@link TableRow}s.
     */
    record Tabular(NodeId id, SourceSpan span, String environment, String columnSpec, List<Node> children)
        implements Node {
        public Tabular {
            children = List.copyOf(children);
        }

        @Override
        public Tabular withChildren(final List<Node> children) {
            return new Tabular(id, span, environment, columnSpec, children);
        }
    }

    /**
     * A grid row; its children are {@link TableCell}s.
     */
    record TableRow(NodeId id, SourceSpan span, List<Node> children) implements Node {
        public TableRow {
            children = List.copyOf(children);
        }

        @Override
        public TableRow withChildren(final List<Node> children) {
            return new TableRow(id, span, children);
        }
    }

    record TableCell(NodeId id, SourceSpan span, int columnSpan, List<Node> children) implements Node {
        public TableCell {
            children = List.copyOf(children);
        }

        @Override
        public TableCell withChildren(final List<Node> children) {
            return new TableCell(id, span, columnSpan, children);
        }
    }

    /**
     * A figure float. Its children include images, diagrams, its caption and its labels.
     */
    record Figure(NodeId id, SourceSpan span, String environment, @Nullable String number, List<Node> children)
        implements Node {
        public Figure {
            children = List.copyOf(children);
        }

        @Override
        public Figure withChildren(final List<Node> children) {
            return new Figure(id, span, environment, number, children);
        }

        @Override
        public Figure withNumber(final String number) {
            return new Figure(id, span, environment, number, children);
        }
    }

    /**
     * An algorithm float. Its children include its caption, its labels and its pseudocode.
     *
     * @param environment {@code algorithm}, or the pseudocode environment when the algorithm stands alone.
     */
    record Algorithm(NodeId id, SourceSpan span, String environment, @Nullable String number, List<Node> children)
        implements Node {
        public Algorithm {
            children = List.copyOf(children);
        }

        @Override
        public Algorithm withChildren(final List<Node> children) {
            return new Algorithm(id, span, environment, number, children);
        }

        @Override
        public Algorithm withNumber(final String number) {
            return new Algorithm(id, span, environment, number, children);
        }
    }

    /**
     * The body of an {@code algorithmic} or {@code algorithm2e} environment, read into indented lines.
     */
    record Pseudocode(NodeId id, SourceSpan span, String environment, List<PseudocodeLine> lines) implements Node {
        public Pseudocode {
            lines = List.copyOf(lines);
        }
    }

    /**
     * An {@code \includegraphics} reference.
     *
     * @param path    The image path as written.
     * @param options The raw optional argument, empty if absent.
     */
    record Image(NodeId id, SourceSpan span, String path, String options) implements Node {
    }

    record Caption(NodeId id, SourceSpan span, List<Node> children) implements Node {
        public Caption {
            children = List.copyOf(children);
        }

        @Override
        public Caption withChildren(final List<Node> children) {
            return new Caption(id, span, children);
        }
    }

    /**
     * Verbatim code, copied byte for byte.
     *
     * @param environment The verbatim environment or inline command it came from.
     * @param language    The language tag for highlighting, if given.
     * @param lineNumbers Whether lines should be numbered when displayed.
     * @param caption     The listing caption, if given.
     */
    record CodeBlock(
        NodeId id,
        SourceSpan span,
        String environment,
        @Nullable String language,
        String text,
        boolean lineNumbers,
        boolean inline,
        @Nullable String caption,
        @Nullable String number
    ) implements Node {
        @Override
        public CodeBlock withNumber(final String number) {
            return new CodeBlock(id, span, environment, language, text, lineNumbers, inline, caption, number);
        }
    }

    /**
     * A diagram to be rendered by an external tool.
     *
     * @param source The complete diagram source, {@code \begin} and {@code \end} included.
     */
    record DiagramBlock(NodeId id, SourceSpan span, String environment, String source, DiagramRendering rendering)
        implements Node {
        public DiagramBlock withRendering(final DiagramRendering rendering) {
            return new DiagramBlock(id, span, environment, source, rendering);
        }
    }

    record Formatting(NodeId id, SourceSpan span, FormattingStyle style, List<Node> children) implements Node {
        public Formatting {
            children = List.copyOf(children);
        }

        @Override
        public Formatting withChildren(final List<Node> children) {
            return new Formatting(id, span, style, children);
        }
    }

    /**
     * An unresolved reference or citation, as produced by the parser.
     */
    record CrossRef(NodeId id, SourceSpan span, String key, ReferenceKind kind) implements Node {
    }

    /**
     * A reference or citation rewritten by the resolver.
     *
     * @param display The text to display: a number, a citation marker, or a fallback such as a title.
     * @param target  The identifier of the target: a node identifier, or {@code cite:key} for citations.
     */
    record ResolvedLink(NodeId id, SourceSpan span, String key, ReferenceKind kind, String display, String target)
        implements Node {
    }

    /**
     * A reference or citation whose key does not exist.
     */
    record UnresolvedPlaceholder(NodeId id, SourceSpan span, String key, ReferenceKind kind) implements Node {
    }

    /**
     * A {@code \label} declaration.
     *
     * @param target The node the label names.
     */
    record Label(NodeId id, SourceSpan span, String key, NodeId target) implements Node {
    }

    record Footnote(NodeId id, SourceSpan span, @Nullable String number, List<Node> children) implements Node {
        public Footnote {
            children = List.copyOf(children);
        }

        @Override
        public Footnote withChildren(final List<Node> children) {
            return new Footnote(id, span, number, children);
        }

        @Override
        public Footnote withNumber(final String number) {
            return new Footnote(id, span, number, children);
        }
    }

    record Hyperlink(NodeId id, SourceSpan span, String url, List<Node> children) implements Node {
        public Hyperlink {
            children = List.copyOf(children);
        }

        @Override
        public Hyperlink withChildren(final List<Node> children) {
            return new Hyperlink(id, span, url, children);
        }
    }

    record LineBreak(NodeId id, SourceSpan span) implements Node {
    }

    record Text(NodeId id, SourceSpan span, String text) implements Node {
    }
}
