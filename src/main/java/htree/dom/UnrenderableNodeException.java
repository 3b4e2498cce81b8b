// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htree.dom;

import java.util.List;
import htree.util.Trace;

/**
 * Thrown when a tree contains something that cannot be represented as markup, such as an error node.
 * <p>
 * The exception captures the renderer's active {@link Trace}s at the point of failure, so that
 * {@link #detailedMessage()} can tell where in the tree rendering stopped. Output written before the failure stays
 * written.
 */
public final class UnrenderableNodeException extends IllegalArgumentException {
    /**
     * Initializes a new exception with the given message, capturing the calling thread's active traces.
     */
    public UnrenderableNodeException(final String message) {
        super(message);
        traces = List.copyOf(Trace.activeTraces());
    }

    /**
     * Retrieves the trace messages active when the exception was created, innermost first.
     */
    public List<String> traces() {
        return traces;
    }

    /**
     * Retrieves the message followed by the list of active traces.
     */
    public String detailedMessage() {
        final var builder = new StringBuilder(getMessage());
        for (final var trace : traces) {
            builder.append("\n - ");
            builder.append(trace);
        }
        return builder.toString();
    }

    private static final long serialVersionUID = 1L;

    // Strings only, so serialization works out.
    @SuppressWarnings("serial")
    private final List<String> traces;
}
