// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import java.util.Locale;
import texweave.document.DivisionLevel;
import texweave.util.annotation.Nullable;

/**
 * When a counter goes back to zero.
 */
public enum ResetScope {
    GLOBAL(null),
    PER_PART(DivisionLevel.PART),
    PER_CHAPTER(DivisionLevel.CHAPTER),
    PER_SECTION(DivisionLevel.SECTION);

    ResetScope(final @Nullable DivisionLevel level) {
        this.level = level;
    }

    /**
     * Returns the division level whose start resets the counter, or {@code null} for a counter that never resets.
     */
    public @Nullable DivisionLevel level() {
        return level;
    }

    /**
     * Parses a configuration value such as {@code "chapter"} or {@code "per-chapter"}, or returns {@code null}.
     */
    public static @Nullable ResetScope parse(final String value) {
        final var normalized = value.strip().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized.startsWith("per-") ? normalized.substring(4) : normalized) {
            case "global", "none", "never", "document" -> GLOBAL;
            case "part" -> PER_PART;
            case "chapter" -> PER_CHAPTER;
            case "section" -> PER_SECTION;
            default -> null;
        };
    }

    /**
     * Returns the scope resetting at sectioning command {@code name}, as used by {@code \newtheorem} and
     * {@code \numberwithin}, or {@code null}.
     */
    public static @Nullable ResetScope ofDivisionName(final String name) {
        final var level = DivisionLevel.ofCommand(name.strip());
        if (level == null) {
            return null;
        }
        return switch (level) {
            case PART -> PER_PART;
            case CHAPTER -> PER_CHAPTER;
            default -> PER_SECTION;
        };
    }

    private final @Nullable DivisionLevel level;
}
