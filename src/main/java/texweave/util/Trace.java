// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.util;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import texweave.util.condition.MessageSupplier;

/**
 * A user-readable description of the operation in progress, registered for the lifetime of a try-with-resources
 * block.
 * <p>
 * When a fatal diagnostic or an I/O failure is reported, the active traces of the reporting thread are printed
 * alongside it, innermost first, so the user can tell which file, stage and construct was being worked on. Traces are
 * confined to the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a trace whose message is computed only if somebody asks for it.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Registers a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var chain = localChain.get();
        outer = chain.innermost;
        this.messageOrSupplier = messageOrSupplier;
        this.chain = chain;
        chain.innermost = this;
    }

    /**
     * Returns a snapshot of the calling thread's active trace messages, innermost first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localChain.get().innermost; trace != null; trace = trace.outer) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing; referencing the resource keeps compilers from warning about an unused try-with-resources variable.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert chain == localChain.get() : "Trace closed by a different thread";
        assert chain.innermost == this : "Traces closed out of order";
        chain.innermost = outer;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static final ThreadLocal<Chain> localChain = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace outer;
    // Either the message itself or a MessageSupplier not yet called.
    private Object messageOrSupplier;
    private final Chain chain;

    private static final class Chain {
        private @Nullable Trace innermost = null;
    }
}
