// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The flattened text of a whole project, with every inclusion command replaced by the included file's contents.
 * <p>
 * An origin map records, for every run of characters, which file and offset it was copied from, so any offset in the
 * flattened text can be mapped back to a file, line and column.
 */
public final class SourceText {
    SourceText(
        final Path rootDirectory,
        final SourceFile rootFile,
        final String text,
        final List<Segment> segments,
        final List<SourceFile> files,
        final List<SourceFile> bibliographyFiles
    ) {
        this.rootDirectory = rootDirectory;
        this.rootFile = rootFile;
        this.text = text;
        this.segments = List.copyOf(segments);
        this.files = List.copyOf(files);
        this.bibliographyFiles = List.copyOf(bibliographyFiles);
    }

    /**
     * Creates a flattened text consisting of a single file, with no inclusions expanded.
     */
    public static SourceText ofSingleFile(final SourceFile file) {
        final var parent = file.path().toAbsolutePath().getParent();
        return new SourceText(
            (parent == null) ? file.path() : parent,
            file,
            file.text(),
            List.of(new Segment(0, file, 0, file.text().length())),
            List.of(file),
            List.of()
        );
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public char charAt(final int offset) {
        return text.charAt(offset);
    }

    public Path rootDirectory() {
        return rootDirectory;
    }

    public SourceFile rootFile() {
        return rootFile;
    }

    /**
     * Returns every distinct file that contributed text, in the order they were first included.
     */
    public List<SourceFile> files() {
        return files;
    }

    /**
     * Returns the bibliography databases named by {@code \bibliography} and {@code \addbibresource} commands.
     */
    public List<SourceFile> bibliographyFiles() {
        return bibliographyFiles;
    }

    /**
     * Maps an offset in the flattened text back to its original file, line and column. The offset equal to the text
     * length maps to the end of the last contributing run.
     */
    public SourceOrigin originAt(final int offset) {
        assert offset >= 0 && offset <= text.length() : "Offset out of range: " + offset;
        if (segments.isEmpty()) {
            return rootFile.originAt(0);
        }
        var low = 0;
        var high = segments.size() - 1;
        while (low < high) {
            final var middle = (low + high + 1) >>> 1;
            if (segments.get(middle).start() <= offset) {
                low = middle;
            } else {
                high = middle - 1;
            }
        }
        final var segment = segments.get(low);
        final var delta = Math.min(offset - segment.start(), segment.length());
        return segment.file().originAt(segment.fileOffset() + delta);
    }

    /**
     * Returns the span between two flattened offsets.
     */
    public SourceSpan spanOf(final int start, final int end) {
        return new SourceSpan(originAt(start), originAt(end));
    }

    private final Path rootDirectory;
    private final SourceFile rootFile;
    private final String text;
    private final List<Segment> segments;
    private final List<SourceFile> files;
    private final List<SourceFile> bibliographyFiles;

    /**
     * A run of characters copied verbatim from one file.
     */
    record Segment(int start, SourceFile file, int fileOffset, int length) {
    }

    static final class Builder {
        Builder(final Path rootDirectory) {
            this.rootDirectory = rootDirectory;
        }

        void append(final SourceFile file, final int from, final int to) {
            if (from >= to) {
                return;
            }
            segments.add(new Segment(text.length(), file, from, to - from));
            text.append(file.text(), from, to);
        }

        SourceText build(
            final SourceFile rootFile,
            final List<SourceFile> files,
            final List<SourceFile> bibliographyFiles
        ) {
            return new SourceText(rootDirectory, rootFile, text.toString(), segments, files, bibliographyFiles);
        }

        private final Path rootDirectory;
        private final StringBuilder text = new StringBuilder();
        private final List<Segment> segments = new ArrayList<>();
    }
}
