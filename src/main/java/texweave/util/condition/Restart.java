// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

import org.jetbrains.annotations.Nullable;
import texweave.util.SneakyThrow;

/**
 * A named point on the stack that a handler can transfer control to.
 * <p>
 * Restarts are established with {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
public final class Restart {
    Restart(final String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    public String name() {
        return name;
    }

    /**
     * Unwinds the stack up to this restart point. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restarts unlinked out of order";
        ownerContext.firstRestart = next;
    }

    @Override
    public String toString() {
        return "Restart[" + name + "]";
    }

    final @Nullable Restart next;
    private final String name;
    private final ConditionContext ownerContext;
}
