// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.ir;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import texweave.bibliography.CitationRegistry;
import texweave.config.EnvironmentTable;
import texweave.config.Metadata;
import texweave.config.Tab;
import texweave.diagnostic.Diagnostic;
import texweave.document.Node;
import texweave.resolve.LabelRegistry;

/**
 * The result of a successful conversion: the resolved document tree and every registry the renderer needs.
 *
 * @param metadata      The effective metadata, configuration overrides applied.
 * @param root          The numbered tree, with every cross reference resolved and every diagram rendered or not.
 * @param labels        Every declared label.
 * @param citations     Every bibliography entry, cited or not.
 * @param citedKeys     The keys cited by the document, in order of first citation.
 * @param mathMacros    Math macros for the math renderer, sorted by name.
 * @param tabs          Navigation tabs.
 * @param environments  The effective environment table.
 * @param graphicsPaths Directories images are looked up in, as declared with {@code \graphicspath}.
 * @param warnings      Every warning signaled during the conversion, in reporting order.
 */
public record DocumentIr(
    Metadata metadata,
    Node.DocumentRoot root,
    LabelRegistry labels,
    CitationRegistry citations,
    List<String> citedKeys,
    Map<String, String> mathMacros,
    List<Tab> tabs,
    EnvironmentTable environments,
    List<String> graphicsPaths,
    List<Diagnostic> warnings
) {
    public DocumentIr {
        citedKeys = List.copyOf(citedKeys);
        mathMacros = Collections.unmodifiableMap(new TreeMap<>(mathMacros));
        tabs = List.copyOf(tabs);
        graphicsPaths = List.copyOf(graphicsPaths);
        warnings = List.copyOf(warnings);
    }

    public DocumentIr withWarnings(final List<Diagnostic> warnings) {
        return new DocumentIr(
            metadata,
            root,
            labels,
            citations,
            citedKeys,
            mathMacros,
            tabs,
            environments,
            graphicsPaths,
            warnings
        );
    }
}
