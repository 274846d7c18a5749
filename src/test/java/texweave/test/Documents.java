// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import texweave.config.EnvironmentTable;
import texweave.document.DivisionLevel;
import texweave.document.Node;
import texweave.document.NodeIdGenerator;
import texweave.parse.Parser;
import texweave.parse.TextNormalizer;
import texweave.source.SourceFile;
import texweave.source.SourceText;

// Helpers for building and inspecting document trees.
final class Documents {
    private Documents() {
    }

    static SourceText source(final String text) {
        return SourceText.ofSingleFile(SourceFile.of(MemorySourceReader.root.resolve("main.tex"), "main.tex", text));
    }

    static Node.DocumentRoot parse(final String body) {
        return parse(body, DivisionLevel.CHAPTER);
    }

    static Node.DocumentRoot parse(final String body, final DivisionLevel topLevel) {
        final var source = source(body);
        return Parser.parse(
            source,
            0,
            source.length(),
            EnvironmentTable.defaults("en"),
            topLevel,
            new NodeIdGenerator()
        );
    }

    // Every node of the given type, in document order, titles and item labels included.
    static <T extends Node> List<T> find(final Node root, final Class<T> type) {
        final var result = new ArrayList<T>();
        final var pending = new ArrayDeque<Node>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final var node = pending.pop();
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
            final var contents = new ArrayList<Node>();
            if (node instanceof final Node.Division division) {
                contents.addAll(division.title());
            } else if (node instanceof final Node.Environment environment) {
                contents.addAll(environment.title());
            } else if (node instanceof final Node.ListItem item) {
                contents.addAll(item.label());
            }
            contents.addAll(node.children());
            for (int i = contents.size() - 1; i >= 0; i -= 1) {
                pending.push(contents.get(i));
            }
        }
        return result;
    }

    static <T extends Node> T only(final Node root, final Class<T> type) {
        final var found = find(root, type);
        if (found.size() != 1) {
            throw new AssertionError("Expected exactly one " + type.getSimpleName() + ", found " + found.size());
        }
        return found.get(0);
    }

    static String lines(final String... lines) {
        return String.join("\n", lines) + "\n";
    }

    static String text(final List<Node> nodes) {
        return TextNormalizer.toPlainText(nodes);
    }

    static String text(final Node node) {
        return TextNormalizer.toPlainText(List.of(node));
    }

    static final Path mainFile = MemorySourceReader.root.resolve("main.tex");
}
