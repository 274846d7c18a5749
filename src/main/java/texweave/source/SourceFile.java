// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * The complete text of one file read by the {@link SourceLoader}.
 */
public final class SourceFile {
    SourceFile(final Path path, final String displayName, final String text) {
        this.path = path;
        this.displayName = displayName;
        this.text = text;
        lineStarts = computeLineStarts(text);
    }

    /**
     * Creates a source file not tied to the loader, such as a bibliography given on its own.
     */
    public static SourceFile of(final Path path, final String displayName, final String text) {
        return new SourceFile(path, displayName, text);
    }

    public Path path() {
        return path;
    }

    /**
     * Returns the name used in diagnostics: the path relative to the project root.
     */
    public String displayName() {
        return displayName;
    }

    public String text() {
        return text;
    }

    /**
     * Returns the line and column of the character at {@code offset} in this file.
     */
    public SourceOrigin originAt(final int offset) {
        assert offset >= 0 && offset <= text.length() : "Offset out of range: " + offset;
        final var search = Arrays.binarySearch(lineStarts, offset);
        final var lineIndex = (search >= 0) ? search : (-search - 2);
        return new SourceOrigin(displayName, lineIndex + 1, offset - lineStarts[lineIndex] + 1);
    }

    @Override
    public String toString() {
        return displayName;
    }

    private static int[] computeLineStarts(final String text) {
        var count = 1;
        for (int i = 0; i < text.length(); i += 1) {
            if (text.charAt(i) == '\n') {
                count += 1;
            }
        }
        final var starts = new int[count];
        var line = 1;
        for (int i = 0; i < text.length(); i += 1) {
            if (text.charAt(i) == '\n') {
                starts[line] = i + 1;
                line += 1;
            }
        }
        return starts;
    }

    private final Path path;
    private final String displayName;
    private final String text;
    private final int[] lineStarts;
}
