// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

/**
 * How resolved citations are displayed.
 */
public enum CitationStyle {
    /**
     * The citation key in brackets: {@code [knuth84]}.
     */
    KEY,
    /**
     * A number in brackets, in order of first citation: {@code [1]}.
     */
    NUMERIC,
}
