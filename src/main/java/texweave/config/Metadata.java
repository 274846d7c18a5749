// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import texweave.util.annotation.Nullable;

/**
 * Document metadata. In a configuration every field is an optional override; after a conversion, the effective
 * values with the overrides applied over what the preamble declared.
 */
public record Metadata(
    @Nullable String title,
    @Nullable String subtitle,
    @Nullable String author,
    @Nullable String version,
    @Nullable String date,
    @Nullable String language
) {
    public static final Metadata empty = new Metadata(null, null, null, null, null, null);

    /**
     * Returns these values with every non-null field of {@code overrides} taking precedence.
     */
    public Metadata overriddenBy(final Metadata overrides) {
        return new Metadata(
            pick(overrides.title, title),
            pick(overrides.subtitle, subtitle),
            pick(overrides.author, author),
            pick(overrides.version, version),
            pick(overrides.date, date),
            pick(overrides.language, language)
        );
    }

    private static @Nullable String pick(final @Nullable String preferred, final @Nullable String fallback) {
        return (preferred != null) ? preferred : fallback;
    }
}
