// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type of everything that can be signaled through a {@link ConditionContext}.
 * <p>
 * Handlers run <em>before</em> the stack is unwound, so a handler may look at the restarts that are active at the
 * signaling point and decide which one, if any, to transfer control to.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the one-line user-readable message.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the message together with any detail useful for a user, such as a source location.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + message;
    }

    private final @NotNull String message;
}
