package io.jtv.core.reversible;

import java.util.List;

/**
 * Ordered record of the updates a reverse block applied in its forward pass. Replaying it backwards
 * with {@link ReversibleExecutor#backward} undoes the block. Immutable.
 */
public record ReversalTrace(List<TraceEntry> entries) {

    public static final ReversalTrace EMPTY = new ReversalTrace(List.of());

    public ReversalTrace {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
