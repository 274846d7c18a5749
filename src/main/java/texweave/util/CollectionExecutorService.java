// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.Unwind;

/**
 * Runs a function over every element of a collection on an {@link ExecutorService}, waiting for all of them.
 * <p>
 * Tasks inherit the caller's {@link ConditionContext} state, so thread-safe handlers installed by the caller see
 * conditions signaled by the tasks. An {@link Unwind} escaping a task is rethrown in the calling thread, after the
 * remaining tasks have been cancelled.
 */
public final class CollectionExecutorService {
    public CollectionExecutorService(final ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Applies {@code function} to every element concurrently and returns the results in iteration order.
     */
    public <T, R> List<R> map(final Iterable<? extends T> iterable, final Function<? super T, ? extends R> function) {
        final var results = new ArrayList<R>();
        new Awaiter<R>(submitTasks(iterable, function).iterator(), results::add).awaitAll();
        return results;
    }

    private <T, R> List<Future<R>> submitTasks(
        final Iterable<? extends T> iterable,
        final Function<? super T, ? extends R> function
    ) {
        final var inheritedState = ConditionContext.saveInheritableState();
        final var futures = new ArrayList<Future<R>>();
        for (final T item : iterable) {
            futures.add(executorService.submit(() -> {
                final var previousState = ConditionContext.inheritState(inheritedState);
                try (final var trace = new Trace(() -> "Running a task in " + Thread.currentThread().getName())) {
                    trace.use();
                    return function.apply(item);
                } finally {
                    ConditionContext.restoreState(previousState);
                }
            }));
        }
        return futures;
    }

    private final ExecutorService executorService;

    private static final class Awaiter<T> {
        private Awaiter(final Iterator<? extends Future<? extends T>> iterator, final Consumer<? super T> consumer) {
            this.iterator = iterator;
            this.consumer = consumer;
        }

        private void awaitAll() {
            try {
                while (iterator.hasNext()) {
                    awaitOne(iterator.next());
                }
                if (foundInterrupt) {
                    throw new AssertionError("A task was interrupted, but no other task failed");
                }
            } finally {
                if (needsCancellation) {
                    while (iterator.hasNext()) {
                        iterator.next().cancel(true);
                    }
                }
            }
        }

        private void awaitOne(final Future<? extends T> future) {
            try {
                consumer.accept(future.get());
            } catch (final InterruptedException e) {
                throw SneakyThrow.doThrow(e);
            } catch (final ExecutionException e) {
                recover(e);
            }
        }

        private void recover(final ExecutionException executionException) {
            needsCancellation = true;
            final var cause = executionException.getCause();
            if (cause instanceof Unwind) {
                // Continue unwinding in the calling thread.
                throw SneakyThrow.doThrow(cause);
            } else if (cause instanceof InterruptedException) {
                // Probably collateral damage; another task should have the real failure.
                foundInterrupt = true;
            } else if (cause instanceof final Error error) {
                throw error;
            } else {
                throw new AssertionError("An exception escaped from a worker task", cause);
            }
        }

        private final Iterator<? extends Future<? extends T>> iterator;
        private final Consumer<? super T> consumer;
        private boolean foundInterrupt = false;
        private boolean needsCancellation = false;
    }
}
