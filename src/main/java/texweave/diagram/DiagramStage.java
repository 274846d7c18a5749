// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagram;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.diagnostic.DiagnosticCondition;
import texweave.diagnostic.DiagnosticKind;
import texweave.document.DiagramRendering;
import texweave.document.Node;
import texweave.document.NodeId;
import texweave.util.CollectionExecutorService;
import texweave.util.Trace;

/**
 * Renders every diagram of a tree concurrently.
 * <p>
 * A diagram whose rendering fails becomes {@link DiagramRendering.Unavailable} and yields a
 * {@code DiagramNotRendered} warning; other diagrams are not affected.
 */
public final class DiagramStage {
    private DiagramStage() {
    }

    /**
     * @param setup The preamble declarations every diagram is compiled with.
     */
    public static Node.DocumentRoot render(
        final Node.DocumentRoot root,
        final List<String> setup,
        final DiagramRenderer renderer,
        final CollectionExecutorService executor
    ) {
        try (final var trace = new Trace("Rendering diagrams")) {
            trace.use();
            final var diagrams = findDiagrams(root);
            if (diagrams.isEmpty()) {
                return root;
            }
            final var renderings = executor.map(diagrams, diagram -> renderOne(renderer, setup, diagram));
            final var byId = new HashMap<NodeId, DiagramRendering>();
            var renderedCount = 0;
            for (int i = 0; i < diagrams.size(); i += 1) {
                final var rendering = renderings.get(i);
                byId.put(diagrams.get(i).id(), rendering);
                if (rendering instanceof DiagramRendering.Rendered) {
                    renderedCount += 1;
                }
            }
            logger.info("Rendered {} of {} diagram(s)", renderedCount, diagrams.size());
            return (Node.DocumentRoot) replace(root, byId);
        }
    }

    private static DiagramRendering renderOne(
        final DiagramRenderer renderer,
        final List<String> setup,
        final Node.DiagramBlock diagram
    ) {
        final var name = "diagram-" + diagram.id().value();
        final var request = new DiagramRequest(name, diagram.environment(), diagram.source(), setup);
        try {
            return new DiagramRendering.Rendered(renderer.render(request));
        } catch (final DiagramRenderingException e) {
            DiagnosticCondition.warn(
                DiagnosticKind.DIAGRAM_NOT_RENDERED,
                diagram.environment() + " diagram not rendered: " + e.getMessage(),
                diagram.span().start()
            );
            return new DiagramRendering.Unavailable(String.valueOf(e.getMessage()));
        }
    }

    private static List<Node.DiagramBlock> findDiagrams(final Node root) {
        final var result = new ArrayList<Node.DiagramBlock>();
        final var pending = new ArrayDeque<Node>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            if (node instanceof final Node.DiagramBlock diagram) {
                result.add(diagram);
            }
            final var children = node.children();
            for (int i = children.size() - 1; i >= 0; i -= 1) {
                pending.push(children.get(i));
            }
        }
        return result;
    }

    private static Node replace(final Node node, final Map<NodeId, DiagramRendering> renderings) {
        if (node instanceof final Node.DiagramBlock diagram) {
            final var rendering = renderings.get(diagram.id());
            return (rendering != null) ? diagram.withRendering(rendering) : diagram;
        }
        if (node.children().isEmpty()) {
            return node;
        }
        final var children = new ArrayList<Node>(node.children().size());
        for (final var child : node.children()) {
            children.add(replace(child, renderings));
        }
        return node.withChildren(children);
    }

    private static final Logger logger = LoggerFactory.getLogger(DiagramStage.class);
}
