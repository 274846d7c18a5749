// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition.exception;

import java.io.IOException;

/**
 * Signaled when reading a source file or writing the document IR fails.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
