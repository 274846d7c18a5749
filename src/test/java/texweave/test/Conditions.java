// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.util.concurrent.atomic.AtomicReference;
import texweave.util.condition.Condition;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.Handler;

// Runs code that is expected to signal a fatal condition and captures it.
final class Conditions {
    private Conditions() {
    }

    static Condition fatalConditionOf(final Runnable work) {
        final var captured = new AtomicReference<Condition>();
        ConditionContext.withRestart("test-abort", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    captured.set(signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                work.run();
            }
            return null;
        });
        final var condition = captured.get();
        if (condition == null) {
            throw new AssertionError("No fatal condition was signaled");
        }
        return condition;
    }
}
