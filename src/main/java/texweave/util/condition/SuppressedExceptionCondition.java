// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

/**
 * Signaled when a cleanup operation, such as deleting a temporary directory, failed and the failure was suppressed.
 * <p>
 * Never fatal. Handlers must not unwind in response; {@link ConditionContext#signalSuppressedException(Exception)}
 * treats that as a programming error.
 */
public final class SuppressedExceptionCondition extends Condition {
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
        this.exception = exception;
    }

    public Exception exception() {
        return exception;
    }

    private final Exception exception;
}
