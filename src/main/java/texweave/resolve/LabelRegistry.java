// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.resolve;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import texweave.util.annotation.Nullable;

/**
 * The mapping from label key to {@link LabelEntry}. Keys are unique and entries never change once registered.
 */
public final class LabelRegistry {
    LabelRegistry(final Map<String, LabelEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public @Nullable LabelEntry lookup(final String key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns every entry in declaration order.
     */
    public Collection<LabelEntry> entries() {
        return entries.values();
    }

    private final Map<String, LabelEntry> entries;
}
