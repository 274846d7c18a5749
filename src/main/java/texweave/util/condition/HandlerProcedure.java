// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to a signaled condition. Returning normally declines it and lets older handlers see it; handling it means
     * transferring control elsewhere, normally with {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;

    /**
     * A handler procedure that may be invoked from any thread.
     * <p>
     * Only thread-safe handlers are visible to worker threads that inherited their parent's condition context through
     * {@link ConditionContext#saveInheritableState()}.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
