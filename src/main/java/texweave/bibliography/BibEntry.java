// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.bibliography;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import texweave.source.SourceOrigin;
import texweave.util.annotation.Nullable;

/**
 * One bibliography entry.
 *
 * @param key    The citation key.
 * @param type   The lower-case entry type, such as {@code article}.
 * @param fields Every field, by lower-case name, with values cleaned for display.
 * @param raw    The entry exactly as written, from {@code @} to the closing delimiter.
 * @param origin Where the entry starts.
 */
public record BibEntry(String key, String type, Map<String, String> fields, String raw, SourceOrigin origin) {
    public BibEntry {
        fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public @Nullable String author() {
        return fields.get("author");
    }

    public @Nullable String title() {
        return fields.get("title");
    }

    public @Nullable String year() {
        return fields.get("year");
    }

    /**
     * Returns where the work appeared: the journal, else the book title, else the publisher.
     */
    public @Nullable String venue() {
        for (final var field : venueFields) {
            final var value = fields.get(field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static final String[] venueFields = {"journal", "booktitle", "publisher"};
}
