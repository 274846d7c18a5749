// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util.condition;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import texweave.util.SneakyThrow;

/**
 * The per-thread registry of installed {@link Handler}s and active {@link Restart}s.
 * <p>
 * Contexts are never exposed; the static methods below always operate on the calling thread's context.
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals a condition that code may safely continue past.
     * <p>
     * Handlers run newest first until one of them transfers control. If they all decline, this method returns
     * normally. Because a handler may unwind, this method may throw {@link Unwind}.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals a condition that code cannot continue past.
     * <p>
     * If every handler declines, {@link UnhandledErrorError} is thrown. The method never returns normally; call sites
     * write {@code throw ConditionContext.error(...)} to tell the compiler so.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Reports an exception that a cleanup operation caught and could not act upon, as a
     * {@link SuppressedExceptionCondition}. Handlers must not unwind in response.
     */
    public static void signalSuppressedException(final @NotNull Exception exception) {
        try {
            SneakyThrow.<Unwind>pretendThrows();
            signal(new SuppressedExceptionCondition(exception));
        } catch (final Unwind u) {
            throw new AssertionError("A handler attempted to unwind a suppressed exception condition", u);
        }
    }

    /**
     * Runs a cleanup {@code callback}, reporting any exception it throws with
     * {@link #signalSuppressedException(Exception)} instead of propagating it.
     */
    public static void withSuppressedExceptions(final @NotNull ThrowingCallback callback) {
        try {
            callback.run();
        } catch (final Exception e) {
            signalSuppressedException(e);
        }
    }

    /**
     * Runs {@code callback} under a fresh restart point named {@code restartName}.
     *
     * @return The value returned by {@code callback}, or {@code null} if a handler unwound to this restart.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's active restarts, newest first.
     */
    public static List<Restart> restarts() {
        final var result = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    /**
     * Captures the handlers and restarts of the calling thread so that a worker thread can adopt them with
     * {@link #inheritState(InheritedState)}.
     * <p>
     * Only {@link HandlerProcedure.ThreadSafe} handlers will actually run in the worker; the rest of the chain is kept
     * as is and skipped at signal time.
     */
    public static InheritedState saveInheritableState() {
        final var context = localContext();
        return new InheritedState(context.firstHandler, context.firstRestart);
    }

    /**
     * Adopts a parent thread's state. The calling thread must have no handlers or restarts of its own.
     *
     * @return A token for {@link #restoreState(PreviousState)}.
     */
    public static PreviousState inheritState(final InheritedState inheritedState) {
        final var context = localContext();
        assert context.firstHandler == null : "Inheriting into a thread that already has handlers";
        assert context.firstRestart == null : "Inheriting into a thread that already has restarts";
        context.firstHandler = inheritedState.firstHandler;
        context.firstRestart = inheritedState.firstRestart;
        return PreviousState.instance;
    }

    /**
     * Drops state adopted with {@link #inheritState(InheritedState)}.
     */
    public static void restoreState(@SuppressWarnings("unused") final PreviousState previousState) {
        final var context = localContext();
        context.firstHandler = null;
        context.firstRestart = null;
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        // A handler that signals must only see the handlers older than itself.
        final var start = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            if (!handler.usableIn(this)) {
                continue;
            }
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    /**
     * A cleanup operation for {@link #withSuppressedExceptions(ThrowingCallback)}.
     */
    @FunctionalInterface
    public interface ThrowingCallback {
        void run() throws Exception;
    }

    /**
     * Opaque handler and restart chain captured from a parent thread.
     */
    public static final class InheritedState {
        private InheritedState(final @Nullable Handler firstHandler, final @Nullable Restart firstRestart) {
            this.firstHandler = firstHandler;
            this.firstRestart = firstRestart;
        }

        private final @Nullable Handler firstHandler;
        private final @Nullable Restart firstRestart;
    }

    /**
     * Opaque token returned by {@link #inheritState(InheritedState)}.
     */
    public static final class PreviousState {
        private PreviousState() {
        }

        private static final PreviousState instance = new PreviousState();
    }
}
