// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.cli;

import java.util.List;
import texweave.util.Trace;
import texweave.util.condition.Condition;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.HandlerProcedure;
import texweave.util.condition.Restart;
import texweave.util.condition.SignaledCondition;
import texweave.util.condition.SuppressedExceptionCondition;

/**
 * The handler of last resort: reports a fatal condition nobody else handled, with the operation trace of the
 * signaling thread, and unwinds to the {@code abort-process} restart.
 * <p>
 * Suppressed exceptions are reported and otherwise ignored.
 */
final class FallbackHandler implements HandlerProcedure.ThreadSafe {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            if (condition.condition() instanceof final SuppressedExceptionCondition c) {
                try (final var streams = Streams.acquire()) {
                    showCondition(streams, c, "A condition");
                }
            }
            return;
        }
        final var restart = chooseRestart(ConditionContext.restarts());
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition(), "A fatal condition");
            streams.err().println("Unwinding to restart " + restart.name() + ".");
        }
        restart.unwindTo();
    }

    private static void showCondition(final Streams streams, final Condition condition, final String prefix) {
        final var err = streams.err();
        err.println(prefix + " of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static Restart chooseRestart(final List<Restart> restarts) {
        if (restarts.isEmpty()) {
            throw new RuntimeException("No restarts available");
        }
        for (final var restart : restarts) {
            if (restart.name().equals(abortProcess)) {
                return restart;
            }
        }
        // Restarts are listed newest first, so the last one is the outermost.
        return restarts.get(restarts.size() - 1);
    }

    static final String abortProcess = "abort-process";

    private static final FallbackHandler instance = new FallbackHandler();
}
