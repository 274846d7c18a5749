// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

import org.jetbrains.annotations.Nullable;
import texweave.util.SneakyThrow;

/**
 * An installed condition handler, active for the duration of a try-with-resources block.
 * <p>
 * Handlers are consulted newest first.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs {@code procedure} as the newest handler of the calling thread.
     */
    public Handler(final HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handlers closed out of order";
        ownerContext.firstHandler = next;
    }

    void handle(final SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
    }

    boolean usableIn(final ConditionContext context) {
        return ownerContext == context || procedure instanceof HandlerProcedure.ThreadSafe;
    }

    final @Nullable Handler next;
    private final HandlerProcedure procedure;
    private final ConditionContext ownerContext;
}
