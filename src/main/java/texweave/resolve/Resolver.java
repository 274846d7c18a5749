// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.bibliography.CitationRegistry;
import texweave.config.CitationStyle;
import texweave.config.EnvironmentTable;
import texweave.diagnostic.DiagnosticCondition;
import texweave.diagnostic.DiagnosticKind;
import texweave.document.Node;
import texweave.document.NodeId;
import texweave.document.ReferenceKind;
import texweave.parse.TextNormalizer;
import texweave.util.Trace;

/**
 * The two-pass label and reference resolver.
 * <p>
 * The first pass walks the numbered tree depth-first and registers every {@code \label} with the number, kind and
 * title of the node it names. Declaring a key twice is a fatal {@code DuplicateLabel} error naming both places. The
 * second pass builds a new tree in which every {@link Node.CrossRef} becomes a {@link Node.ResolvedLink}, or an
 * {@link Node.UnresolvedPlaceholder} together with an {@code UnresolvedReference} warning. Since the first pass sees
 * the whole tree before the second starts, a reference resolves the same whether it precedes its label or not.
 */
public final class Resolver {
    private Resolver(
        final EnvironmentTable environments,
        final CitationRegistry citations,
        final CitationStyle citationStyle
    ) {
        this.environments = environments;
        this.citations = citations;
        this.citationStyle = citationStyle;
    }

    public static Resolution resolve(
        final Node.DocumentRoot root,
        final EnvironmentTable environments,
        final CitationRegistry citations,
        final CitationStyle citationStyle
    ) {
        final var resolver = new Resolver(environments, citations, citationStyle);
        final LabelRegistry labels;
        try (final var trace = new Trace("Collecting labels")) {
            trace.use();
            labels = resolver.collectLabels(root);
        }
        try (final var trace = new Trace("Resolving references")) {
            trace.use();
            final var resolved = (Node.DocumentRoot) resolver.rewrite(root, labels);
            logger.info("Resolved {} reference(s) against {} label(s) and {} citation(s), {} unresolved",
                resolver.resolvedCount, labels.size(), citations.size(), resolver.unresolvedCount);
            return new Resolution(resolved, labels, List.copyOf(resolver.citationNumbers.keySet()));
        }
    }

    private LabelRegistry collectLabels(final Node.DocumentRoot root) {
        final var nodes = new HashMap<NodeId, Node>();
        final var labels = new ArrayList<Node.Label>();
        final var pending = new ArrayDeque<Node>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            nodes.put(node.id(), node);
            if (node instanceof final Node.Label label) {
                labels.add(label);
            }
            final var contents = contents(node);
            for (int i = contents.size() - 1; i >= 0; i -= 1) {
                pending.push(contents.get(i));
            }
        }
        final var entries = new LinkedHashMap<String, LabelEntry>();
        for (final var label : labels) {
            final var previous = entries.get(label.key());
            if (previous != null) {
                throw DiagnosticCondition.fatal(
                    DiagnosticKind.DUPLICATE_LABEL,
                    "Label " + label.key() + " is declared twice, first at " + previous.origin(),
                    label.span().start()
                );
            }
            final var target = nodes.getOrDefault(label.target(), root);
            entries.put(label.key(), describe(label, target));
        }
        logger.debug("Collected {} label(s)", entries.size());
        return new LabelRegistry(entries);
    }

    private LabelEntry describe(final Node.Label label, final Node target) {
        final String kind;
        final String displayLabel;
        final String title;
        if (target instanceof final Node.Division division) {
            kind = division.level().commandName();
            displayLabel = (division.appendix() && kind.equals("chapter")) ? "Appendix" : capitalize(kind);
            title = TextNormalizer.toPlainText(division.title());
        } else if (target instanceof final Node.Environment environment) {
            kind = environment.name();
            displayLabel = environments.lookup(environment.name()).displayLabel();
            title = TextNormalizer.toPlainText(environment.title());
        } else if (target instanceof Node.MathBlock) {
            kind = "equation";
            displayLabel = "Equation";
            title = "";
        } else if (target instanceof final Node.Figure figure) {
            kind = "figure";
            displayLabel = "Figure";
            title = captionOf(figure.children());
        } else if (target instanceof final Node.Table table) {
            kind = "table";
            displayLabel = "Table";
            title = captionOf(table.children());
        } else if (target instanceof final Node.Algorithm algorithm) {
            kind = "algorithm";
            displayLabel = "Algorithm";
            title = captionOf(algorithm.children());
        } else if (target instanceof final Node.CodeBlock code) {
            kind = "listing";
            displayLabel = "Listing";
            title = (code.caption() != null) ? code.caption() : "";
        } else if (target instanceof Node.Footnote) {
            kind = "footnote";
            displayLabel = "Footnote";
            title = "";
        } else if (target instanceof final Node.ListItem item) {
            kind = "item";
            displayLabel = "Item";
            title = TextNormalizer.toPlainText(item.label());
        } else if (target instanceof Node.DocumentRoot) {
            kind = "document";
            displayLabel = "";
            title = "";
        } else {
            kind = target.getClass().getSimpleName().toLowerCase(Locale.ROOT);
            displayLabel = "";
            title = "";
        }
        return new LabelEntry(
            label.key(),
            target.id(),
            target.number(),
            kind,
            displayLabel,
            title,
            label.span().start()
        );
    }

    private Node rewrite(final Node node, final LabelRegistry labels) {
        if (node instanceof final Node.CrossRef reference) {
            return reference.kind().isCitation() ? resolveCitation(reference) : resolveReference(reference, labels);
        } else if (node instanceof final Node.Division division) {
            final var title = rewriteAll(division.title(), labels);
            final var children = rewriteAll(division.children(), labels);
            return new Node.Division(division.id(), division.span(), division.level(), division.numbered(),
                division.appendix(), title, division.number(), children);
        } else if (node instanceof final Node.Environment environment) {
            final var title = rewriteAll(environment.title(), labels);
            final var children = rewriteAll(environment.children(), labels);
            return new Node.Environment(environment.id(), environment.span(), environment.name(), environment.kind(),
                title, environment.number(), children);
        } else if (node instanceof final Node.ListItem item) {
            final var label = rewriteAll(item.label(), labels);
            return new Node.ListItem(item.id(), item.span(), label, rewriteAll(item.children(), labels));
        } else if (node.children().isEmpty()) {
            return node;
        } else {
            return node.withChildren(rewriteAll(node.children(), labels));
        }
    }

    private List<Node> rewriteAll(final List<Node> nodes, final LabelRegistry labels) {
        final var result = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            result.add(rewrite(node, labels));
        }
        return result;
    }

    private Node resolveReference(final Node.CrossRef reference, final LabelRegistry labels) {
        final var entry = labels.lookup(reference.key());
        if (entry == null) {
            return unresolved(reference, "Reference to undefined label " + reference.key());
        }
        final var number = entry.number();
        final String display;
        if (reference.kind() == ReferenceKind.NAMEREF) {
            display = !entry.title().isEmpty() ? entry.title() : (number != null) ? number : entry.fallbackDisplay();
        } else if (number == null) {
            display = entry.fallbackDisplay();
        } else {
            display = switch (reference.kind()) {
                case EQREF -> "(" + number + ")";
                case CREF -> entry.displayLabel().isEmpty() ? number : (entry.displayLabel() + " " + number);
                default -> number;
            };
        }
        resolvedCount += 1;
        return new Node.ResolvedLink(
            reference.id(),
            reference.span(),
            reference.key(),
            reference.kind(),
            display,
            entry.target().toString()
        );
    }

    private Node resolveCitation(final Node.CrossRef reference) {
        final var key = reference.key();
        if (citations.lookup(key) == null) {
            return unresolved(reference, "Citation of unknown bibliography key " + key);
        }
        final int number = citationNumbers.computeIfAbsent(key, unused -> citationNumbers.size() + 1);
        final var display = switch (citationStyle) {
            case KEY -> "[" + key + "]";
            case NUMERIC -> "[" + number + "]";
        };
        resolvedCount += 1;
        return new Node.ResolvedLink(reference.id(), reference.span(), key, reference.kind(), display, "cite:" + key);
    }

    private Node unresolved(final Node.CrossRef reference, final String message) {
        unresolvedCount += 1;
        DiagnosticCondition.warn(DiagnosticKind.UNRESOLVED_REFERENCE, message, reference.span().start());
        return new Node.UnresolvedPlaceholder(reference.id(), reference.span(), reference.key(), reference.kind());
    }

    // Children together with the inline content nodes keep outside their children, such as titles.
    private static List<Node> contents(final Node node) {
        final List<Node> extra;
        if (node instanceof final Node.Division division) {
            extra = division.title();
        } else if (node instanceof final Node.Environment environment) {
            extra = environment.title();
        } else if (node instanceof final Node.ListItem item) {
            extra = item.label();
        } else {
            return node.children();
        }
        if (extra.isEmpty()) {
            return node.children();
        }
        final var result = new ArrayList<Node>(extra);
        result.addAll(node.children());
        return result;
    }

    private static String captionOf(final List<Node> children) {
        for (final var child : children) {
            if (child instanceof final Node.Caption caption) {
                return TextNormalizer.toPlainText(caption.children());
            }
        }
        return "";
    }

    private static String capitalize(final String word) {
        return word.isEmpty() ? word : (Character.toUpperCase(word.charAt(0)) + word.substring(1));
    }

    private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

    private final EnvironmentTable environments;
    private final CitationRegistry citations;
    private final CitationStyle citationStyle;
    // Keys in order of first citation, to their numbers.
    private final Map<String, Integer> citationNumbers = new LinkedHashMap<>();
    private int resolvedCount = 0;
    private int unresolvedCount = 0;
}
