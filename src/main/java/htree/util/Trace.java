// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.util;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message describing what the current thread is doing, intended to be used within try-with-resources.
 * <p>
 * Traces are <em>user-readable</em> context, such as "rendering element {@code <div>}", meant to be attached to error
 * reports; they're <em>not</em> a machine stack trace.
 * <p>
 * Trace objects should <em>never</em> be used outside the thread they were created by.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given <em>lazily evaluated</em> message, and registers it as the innermost
     * active trace of the calling thread.
     * <p>
     * The message supplier is called at most once, and only if someone asks for the active traces.
     */
    public Trace(final MessageSupplier supplier) {
        final var context = localContext();
        next = context.innermost;
        messageOrSupplier = supplier;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns the calling thread's active trace messages, starting with the most recently established one.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext().innermost; trace != null; trace = trace.next) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Dummy method that does nothing, to silence compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace from the current thread's trace chain.
     * <p>
     * This method should never be called manually: use try-with-resources with trace objects instead.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final MessageSupplier supplier) {
            final var string = supplier.get();
            messageOrSupplier = string;
            return string;
        }
        return (String) messageOrSupplier;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself, or a MessageSupplier not called yet.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }
}
