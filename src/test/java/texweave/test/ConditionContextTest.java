// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.util.ArrayList;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import texweave.util.condition.Condition;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.Handler;
import texweave.util.condition.HandlerProcedure;
import texweave.util.condition.UnhandledErrorError;

final class ConditionContextTest {
    @Test
    void handlerUnwindsToTheRestart() {
        final var reached = new ArrayList<String>();
        final var result = ConditionContext.withRestart("outer", restart -> {
            final HandlerProcedure procedure = signaled -> restart.unwindTo();
            try (final var handler = new Handler(procedure)) {
                handler.use();
                ConditionContext.signal(new TestCondition("stop"));
                reached.add("after signal");
            }
            return "completed";
        });
        Assertions.assertThat(result).isNull();
        Assertions.assertThat(reached).isEmpty();
        Assertions.assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void decliningHandlersLetSignalReturn() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(signaled -> seen.add("outer " + signaled.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(signaled -> seen.add("inner " + signaled.condition().message()))) {
                inner.use();
                ConditionContext.signal(new TestCondition("note"));
            }
        }
        Assertions.assertThat(seen).containsExactly("inner note", "outer note");
    }

    @Test
    void unhandledErrorIsThrown() {
        Assertions.assertThatThrownBy(() -> {
            throw ConditionContext.error(new TestCondition("broken"));
        }).isInstanceOf(UnhandledErrorError.class);
    }

    @Test
    void unwindPassesThroughInnerRestarts() {
        final var result = ConditionContext.withRestart("outer", outer -> {
            final var inner = ConditionContext.withRestart("inner", ignored -> {
                try (final var handler = new Handler(signaled -> outer.unwindTo())) {
                    handler.use();
                    ConditionContext.signal(new TestCondition("leave"));
                }
                return "inner";
            });
            return "outer saw " + inner;
        });
        Assertions.assertThat(result).isNull();
    }

    private static final class TestCondition extends Condition {
        TestCondition(final String message) {
            super(message);
        }
    }
}
