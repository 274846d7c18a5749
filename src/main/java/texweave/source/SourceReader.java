// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The filesystem as seen by the {@link SourceLoader}.
 */
public interface SourceReader {
    /**
     * Returns whether {@code path} names a readable regular file.
     */
    boolean isFile(Path path);

    /**
     * Reads the whole file at {@code path} as UTF-8 text.
     */
    String read(Path path) throws IOException;
}
