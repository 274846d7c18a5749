// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined a fatal condition. That means no
 * handler with a restart was installed, which is a programming error.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final Condition condition) {
        super("Fatal condition signaled, but no handler unwound; condition: " + condition);
    }
}
