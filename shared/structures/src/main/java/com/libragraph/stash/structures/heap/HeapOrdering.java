package com.libragraph.stash.structures.heap;

import java.util.Objects;

/**
 * The single comparison a {@link PriorityHeap} is built with.
 *
 * <p>Exactly one of three modes is active:
 * <ul>
 *   <li>{@link Mode#PRIORITY}: compares node priorities</li>
 *   <li>{@link Mode#DATA}: compares payloads</li>
 *   <li>{@link Mode#DATA_WITH_CONTEXT}: compares payloads with a fixed context</li>
 * </ul>
 * In the data modes the stored priority is ignored.
 */
public final class HeapOrdering<T> {

    public enum Mode {
        PRIORITY,
        DATA,
        DATA_WITH_CONTEXT
    }

    private final Mode mode;
    private final PriorityLess priorityLess;
    private final DataLess<? super T> dataLess;
    private final Object context;

    private HeapOrdering(Mode mode, PriorityLess priorityLess, DataLess<? super T> dataLess, Object context) {
        this.mode = mode;
        this.priorityLess = priorityLess;
        this.dataLess = dataLess;
        this.context = context;
    }

    public static <T> HeapOrdering<T> byPriority(PriorityLess less) {
        Objects.requireNonNull(less, "priority comparator cannot be null");
        return new HeapOrdering<>(Mode.PRIORITY, less, null, null);
    }

    public static <T> HeapOrdering<T> byData(DataLess<? super T> less) {
        Objects.requireNonNull(less, "data comparator cannot be null");
        return new HeapOrdering<>(Mode.DATA, null, less, null);
    }

    public static <T, C> HeapOrdering<T> byData(ContextLess<? super T, ? super C> less, C context) {
        Objects.requireNonNull(less, "data comparator cannot be null");
        DataLess<T> bound = (a, b) -> less.less(a, b, context);
        return new HeapOrdering<>(Mode.DATA_WITH_CONTEXT, null, bound, context);
    }

    public Mode mode() {
        return mode;
    }

    /** The context of a {@link Mode#DATA_WITH_CONTEXT} ordering, otherwise {@code null}. */
    public Object context() {
        return context;
    }

    boolean less(HeapNode<T> a, HeapNode<T> b) {
        return switch (mode) {
            case PRIORITY -> priorityLess.less(a.priority(), b.priority());
            case DATA, DATA_WITH_CONTEXT -> dataLess.less(a.data(), b.data());
        };
    }
}
