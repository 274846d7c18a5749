// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

import java.util.Comparator;

/**
 * A position in an original source file.
 *
 * @param file   The file's path relative to the project root, with {@code /} separators.
 * @param line   1-based line number.
 * @param column 1-based column number, counted in UTF-16 code units.
 */
public record SourceOrigin(String file, int line, int column) implements Comparable<SourceOrigin> {
    @Override
    public int compareTo(final SourceOrigin other) {
        return order.compare(this, other);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }

    private static final Comparator<SourceOrigin> order = Comparator.comparing(SourceOrigin::file)
        .thenComparingInt(SourceOrigin::line)
        .thenComparingInt(SourceOrigin::column);
}
