// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads sources from the default filesystem.
 */
public final class FileSystemSourceReader implements SourceReader {
    private FileSystemSourceReader() {
    }

    public static FileSystemSourceReader instance() {
        return instance;
    }

    @Override
    public boolean isFile(final Path path) {
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    @Override
    public String read(final Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static final FileSystemSourceReader instance = new FileSystemSourceReader();
}
