// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import texweave.source.SourceReader;

// A source tree kept in memory, rooted at /book.
final class MemorySourceReader implements SourceReader {
    MemorySourceReader with(final String name, final String text) {
        files.put(root.resolve(name), text);
        return this;
    }

    MemorySourceReader unreadable(final String name) {
        files.put(root.resolve(name), "");
        unreadable.add(root.resolve(name));
        return this;
    }

    Path path(final String name) {
        return root.resolve(name);
    }

    Set<Path> readPaths() {
        return readPaths;
    }

    @Override
    public boolean isFile(final Path path) {
        return files.containsKey(path);
    }

    @Override
    public String read(final Path path) throws IOException {
        final var text = files.get(path);
        if (text == null) {
            throw new NoSuchFileException(path.toString());
        }
        if (unreadable.contains(path)) {
            throw new IOException("Permission denied");
        }
        readPaths.add(path);
        return text;
    }

    static final Path root = Path.of("/book");

    private final Map<Path, String> files = new HashMap<>();
    private final Set<Path> unreadable = new HashSet<>();
    private final Set<Path> readPaths = new HashSet<>();
}
