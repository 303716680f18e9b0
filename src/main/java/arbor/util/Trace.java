// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import arbor.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A human-readable note about what the current thread is doing, for use in try-with-resources.
 * <p>
 * Condition handlers run before the stack unwinds, so they can list the traces active at the point a condition was
 * signaled, telling the user <em>where</em> in the input a problem was found. Traces are not stack traces: they
 * describe the input being processed, not the code processing it.
 * <p>
 * A trace belongs to the thread that created it and must be closed by that thread, in reverse creation order.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a new trace whose message is computed only if someone asks for it.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Registers a new trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var chain = localChain();
        next = chain.innermost;
        owner = chain;
        this.messageOrSupplier = messageOrSupplier;
        chain.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return () -> new MessageIterator(localChain().innermost);
    }

    /**
     * Does nothing; referencing the resource silences "unused resource" warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == localChain() : "Trace closed by a thread other than its owner";
        assert owner.innermost == this : "Traces closed out of order";
        owner.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final MessageSupplier supplier) {
            final var message = supplier.get();
            messageOrSupplier = message;
            return message;
        }
        return (String) messageOrSupplier;
    }

    private static Chain localChain() {
        return chains.get();
    }

    @SuppressWarnings("nullness:type.argument") // Never null, withInitial always supplies a value.
    private static final ThreadLocal<Chain> chains = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace next;
    private final Chain owner;
    // Either a String or a MessageSupplier; replaced with the String once the supplier ran.
    private Object messageOrSupplier;

    private static final class Chain {
        private @Nullable Trace innermost = null;
    }

    private static final class MessageIterator implements Iterator<String> {
        private MessageIterator(final @Nullable Trace first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NonNull String next() {
            final var trace = current;
            if (trace == null) {
                throw new NoSuchElementException("No more traces");
            }
            current = trace.next;
            return trace.message();
        }

        private @Nullable Trace current;
    }
}
