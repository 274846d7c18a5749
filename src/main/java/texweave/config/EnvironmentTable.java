// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The name to behavior lookup table every environment is dispatched through. Names missing from the table get
 * {@link EnvironmentStyle#unknown(String)}.
 */
public final class EnvironmentTable {
    private EnvironmentTable(final Map<String, EnvironmentStyle> styles) {
        this.styles = Collections.unmodifiableMap(new TreeMap<>(styles));
    }

    /**
     * Builds the effective table: the built-in defaults for {@code language}, overridden by {@code declared}
     * (environments the document itself defines), overridden by {@code configured}.
     */
    public static EnvironmentTable of(
        final String language,
        final Map<String, EnvironmentStyle> declared,
        final Map<String, EnvironmentStyle> configured
    ) {
        final var styles = new TreeMap<>(DefaultEnvironments.forLanguage(language));
        styles.putAll(declared);
        styles.putAll(configured);
        return new EnvironmentTable(styles);
    }

    /**
     * Returns the table of built-in environments only.
     */
    public static EnvironmentTable defaults(final String language) {
        return of(language, Map.of(), Map.of());
    }

    public EnvironmentStyle lookup(final String name) {
        final var style = styles.get(name);
        return (style != null) ? style : EnvironmentStyle.unknown(name);
    }

    public boolean contains(final String name) {
        return styles.containsKey(name);
    }

    /**
     * Returns every declared environment, sorted by name.
     */
    public Map<String, EnvironmentStyle> entries() {
        return styles;
    }

    private final Map<String, EnvironmentStyle> styles;
}
