// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.resolve;

import texweave.document.NodeId;
import texweave.source.SourceOrigin;
import texweave.util.annotation.Nullable;

/**
 * A declared label.
 *
 * @param key          The label key.
 * @param target       The node the label names.
 * @param number       The target's number, or {@code null} if the target is unnumbered.
 * @param kind         What the target is: an environment name, a sectioning command name, or one of
 *                     {@code equation}, {@code figure}, {@code table}, {@code listing}, {@code footnote},
 *                     {@code item}, {@code document}.
 * @param displayLabel The user-visible name of the kind, such as {@code "Theorem"} or {@code "Figure"}.
 * @param title        The plain-text title or caption of the target, empty if it has none.
 * @param origin       Where the {@code \label} is.
 */
public record LabelEntry(
    String key,
    NodeId target,
    @Nullable String number,
    String kind,
    String displayLabel,
    String title,
    SourceOrigin origin
) {
    /**
     * Returns what a reference displays when it has no number to show: the title, or the kind's display label.
     */
    public String fallbackDisplay() {
        if (!title.isEmpty()) {
            return title;
        }
        return displayLabel.isEmpty() ? key : displayLabel;
    }
}
