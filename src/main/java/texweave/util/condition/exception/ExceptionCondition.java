// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition.exception;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import texweave.util.condition.Condition;

/**
 * A condition wrapping a Java exception, whose detailed message is the exception's stack trace.
 */
public abstract class ExceptionCondition<E extends Exception> extends Condition {
    protected ExceptionCondition(final E exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Returns the wrapped exception.
     */
    public final E exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var bytes = new ByteArrayOutputStream();
        try (final var printStream = new PrintStream(bytes, false, charset)) {
            exception.printStackTrace(printStream);
        }
        return bytes.toString(charset);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + exception;
    }

    private final E exception;
}
