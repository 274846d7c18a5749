// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.util.annotation.Nullable;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.Handler;
import texweave.util.condition.HandlerProcedure;
import texweave.util.condition.Restart;
import texweave.util.condition.SignaledCondition;

/**
 * Collects every {@link DiagnosticCondition} signaled while running a piece of work, in any thread that inherited the
 * caller's condition context.
 * <p>
 * Warnings are recorded and the signaling code continues. The first fatal diagnostic is recorded and the work is
 * abandoned by unwinding to the collector's {@code abort-conversion} restart. Conditions that are not diagnostics are
 * left to older handlers.
 */
public final class DiagnosticCollector implements HandlerProcedure.ThreadSafe {
    private DiagnosticCollector() {
    }

    /**
     * Runs {@code work}, which must not return {@code null}, with a fresh collector installed.
     *
     * @return The value computed by {@code work}, or no value if a fatal diagnostic aborted it, together with every
     * diagnostic collected, in {@link Diagnostic#reportingOrder()}.
     */
    public static <T> Collected<T> collect(final Supplier<? extends T> work) {
        final var collector = new DiagnosticCollector();
        try (final var handler = new Handler(collector)) {
            handler.use();
            final T value = ConditionContext.withRestart("abort-conversion", restart -> {
                collector.abortRestart = restart;
                return work.get();
            });
            return new Collected<>(collector.wasAborted() ? null : value, collector.sortedDiagnostics());
        }
    }

    @Override
    public void handle(final SignaledCondition signaled) {
        if (!(signaled.condition() instanceof final DiagnosticCondition condition)) {
            return;
        }
        final var diagnostic = condition.diagnostic();
        final Restart restart;
        synchronized (this) {
            diagnostics.add(diagnostic);
            if (!diagnostic.isFatal() && !signaled.isFatal()) {
                return;
            }
            aborted = true;
            restart = abortRestart;
        }
        logger.debug("Aborting conversion: {}", diagnostic);
        if (restart != null) {
            restart.unwindTo();
        }
    }

    private synchronized boolean wasAborted() {
        return aborted;
    }

    private synchronized List<Diagnostic> sortedDiagnostics() {
        final var sorted = new ArrayList<>(diagnostics);
        sorted.sort(Diagnostic.reportingOrder());
        return List.copyOf(sorted);
    }

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private volatile @Nullable Restart abortRestart = null;
    private boolean aborted = false;

    /**
     * The outcome of {@link #collect(Supplier)}.
     *
     * @param value       The computed value, {@code null} iff the work was aborted by a fatal diagnostic.
     * @param diagnostics Every diagnostic signaled, fatal ones included.
     */
    public record Collected<T>(@Nullable T value, List<Diagnostic> diagnostics) {
        public boolean isAborted() {
            return value == null;
        }

        public List<Diagnostic> warnings() {
            return diagnostics.stream().filter(diagnostic -> !diagnostic.isFatal()).toList();
        }

        public List<Diagnostic> fatalDiagnostics() {
            return diagnostics.stream().filter(Diagnostic::isFatal).toList();
        }
    }
}
