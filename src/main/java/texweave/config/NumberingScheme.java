// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import java.util.Locale;
import texweave.util.annotation.Nullable;

/**
 * How the number of a numbered element is formed.
 */
public enum NumberingScheme {
    /**
     * Not numbered.
     */
    NONE,
    /**
     * The bare counter value: {@code "3"}.
     */
    SEQUENTIAL,
    /**
     * The number of the division the counter resets in, a dot, and the counter value: {@code "2.3"}.
     */
    HIERARCHICAL;

    /**
     * Parses a configuration value, or returns {@code null} if it names no scheme.
     */
    public static @Nullable NumberingScheme parse(final String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "none", "off", "false" -> NONE;
            case "sequential", "flat", "plain" -> SEQUENTIAL;
            case "hierarchical", "nested" -> HIERARCHICAL;
            default -> null;
        };
    }
}
