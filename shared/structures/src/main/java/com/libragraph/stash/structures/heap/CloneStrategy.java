package com.libragraph.stash.structures.heap;

import com.libragraph.stash.util.Owned;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * How {@link PriorityHeap#clone(CloneStrategy)} copies payloads.
 *
 * <p>{@link #shallow()} shares the source's payloads. The clone never runs
 * cleanups, and it must not be read after the source heap is closed or the
 * shared payloads are otherwise released.
 *
 * <p>{@link #deep(UnaryOperator)} passes every payload through a copy
 * function; the clone owns the copies and releases them with the source
 * node's cleanup.
 */
public final class CloneStrategy<T> {

    private static final CloneStrategy<Object> SHALLOW = new CloneStrategy<>(null);

    private final UnaryOperator<T> copy;

    private CloneStrategy(UnaryOperator<T> copy) {
        this.copy = copy;
    }

    @SuppressWarnings("unchecked")
    public static <T> CloneStrategy<T> shallow() {
        return (CloneStrategy<T>) SHALLOW;
    }

    public static <T> CloneStrategy<T> deep(UnaryOperator<T> copy) {
        return new CloneStrategy<>(Objects.requireNonNull(copy, "copy function cannot be null"));
    }

    public boolean isShallow() {
        return copy == null;
    }

    Owned<T> duplicate(Owned<T> source) {
        if (copy == null) {
            return Owned.borrowed(source.get());
        }
        return Owned.of(copy.apply(source.get()), source.cleanup());
    }
}
