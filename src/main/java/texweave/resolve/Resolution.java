// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.resolve;

import java.util.List;
import texweave.document.Node;

/**
 * The outcome of resolution.
 *
 * @param root      The tree with every cross reference rewritten.
 * @param labels    Every declared label.
 * @param citedKeys The keys of the bibliography entries cited, in order of first citation.
 */
public record Resolution(Node.DocumentRoot root, LabelRegistry labels, List<String> citedKeys) {
    public Resolution {
        citedKeys = List.copyOf(citedKeys);
    }
}
