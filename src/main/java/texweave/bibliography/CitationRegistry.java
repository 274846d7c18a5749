// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.bibliography;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import texweave.util.annotation.Nullable;

/**
 * The read-only mapping from citation key to bibliography entry.
 */
public final class CitationRegistry {
    CitationRegistry(final Map<String, BibEntry> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static CitationRegistry empty() {
        return empty;
    }

    public @Nullable BibEntry lookup(final String key) {
        return entries.get(key);
    }

    public boolean contains(final String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns every entry, sorted by key.
     */
    public Collection<BibEntry> entries() {
        return entries.values();
    }

    private static final CitationRegistry empty = new CitationRegistry(Map.of());

    private final Map<String, BibEntry> entries;
}
