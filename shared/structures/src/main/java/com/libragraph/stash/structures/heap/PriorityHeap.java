package com.libragraph.stash.structures.heap;

import com.libragraph.stash.structures.array.ChunkedArray;
import com.libragraph.stash.structures.array.ChunkedArray.Slot;
import com.libragraph.stash.util.Owned;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Binary heap over a {@link ChunkedArray} of nodes.
 *
 * <p>Index 0 holds an invalid sentinel so that the children of node {@code i}
 * are {@code 2i} and {@code 2i + 1} and its parent is {@code i / 2}. No valid
 * node is "less" than its parent under the heap's {@link HeapOrdering}, so
 * {@link #top()} and {@link #pop()} return the least element.
 *
 * <p>The heap owns inserted payloads until they are popped: {@link #close()}
 * runs the cleanup of every payload still inside, {@link #pop()} hands the
 * payload to the caller without running it.
 *
 * <p>Not thread-safe.
 */
public class PriorityHeap<T> implements AutoCloseable {

    private static final Logger log = Logger.getLogger(PriorityHeap.class);

    private final HeapOrdering<T> ordering;
    private final ChunkedArray<HeapNode<T>> nodes;

    private PriorityHeap(HeapOrdering<T> ordering) {
        this.ordering = Objects.requireNonNull(ordering, "ordering cannot be null");
        this.nodes = new ChunkedArray<>(HeapNode::destroy);
        nodes.push(HeapNode.invalid());
    }

    /**
     * Heap ordered by ascending priority.
     */
    public static <T> PriorityHeap<T> create() {
        return new PriorityHeap<>(HeapOrdering.byPriority(PriorityLess.ASCENDING));
    }

    public static <T> PriorityHeap<T> withPriorityLess(PriorityLess less) {
        return new PriorityHeap<>(HeapOrdering.byPriority(less));
    }

    public static <T> PriorityHeap<T> withDataLess(DataLess<? super T> less) {
        return new PriorityHeap<>(HeapOrdering.byData(less));
    }

    public static <T, C> PriorityHeap<T> withContextLess(ContextLess<? super T, ? super C> less, C context) {
        return new PriorityHeap<>(HeapOrdering.<T, C>byData(less, context));
    }

    /**
     * Heap sharing an existing ordering, e.g. that of another heap.
     */
    public static <T> PriorityHeap<T> withOrdering(HeapOrdering<T> ordering) {
        return new PriorityHeap<>(ordering);
    }

    /**
     * Adds {@code data} to the heap.
     *
     * <p>A vacant slot is appended and treated as a hole; while the new node is
     * less than the hole's parent, the parent moves down into the hole and the
     * hole moves up. The node is written into the final hole.
     *
     * @param priority ignored by the data orderings
     * @param cleanup  run on {@code data} if it is still in the heap when the heap is closed;
     *                 {@code null} for none
     * @throws IllegalStateException if the heap has been closed; {@code cleanup}
     *                               has already run on {@code data}
     */
    public void insert(long priority, T data, Consumer<? super T> cleanup) {
        Owned<T> payload = Owned.of(data, cleanup);
        if (!nodes.isOpen()) {
            payload.destroy();
            throw new IllegalStateException("Cannot insert into a closed PriorityHeap");
        }
        HeapNode<T> node = HeapNode.of(priority, payload);

        nodes.push(HeapNode.invalid());
        long hole = nodes.size() - 1;
        Slot<HeapNode<T>> holeSlot = nodes.slot(hole);

        while (hole > 1) {
            Slot<HeapNode<T>> parentSlot = nodes.slot(hole / 2);
            HeapNode<T> parent = parentSlot.get();
            if (!ordering.less(node, parent)) {
                break;
            }
            holeSlot.set(parent);
            holeSlot = parentSlot;
            hole /= 2;
        }

        holeSlot.set(node);
    }

    public void insert(long priority, T data) {
        insert(priority, data, null);
    }

    /**
     * Adds {@code data} to a heap ordered by payload.
     *
     * @throws IllegalStateException if the heap is ordered by priority
     */
    public void insert(T data) {
        if (ordering.mode() == HeapOrdering.Mode.PRIORITY) {
            throw new IllegalStateException("A priority-ordered heap needs an explicit priority");
        }
        insert(0, data, null);
    }

    /**
     * The least element, or {@code null} if the heap is empty.
     */
    public T top() {
        if (size() == 0) {
            return null;
        }
        return nodes.at(1).data();
    }

    /**
     * Removes the least element and hands it to the caller; its cleanup is not run.
     *
     * <p>The last node is the candidate for the vacated root. Walking down from
     * the root, the candidate stops once it is less than both children;
     * otherwise the lesser child moves up into the hole. When the children
     * compare equal the right one moves up.
     *
     * @return the removed data, or {@code null} if the heap is empty
     */
    public T pop() {
        long size = size();
        if (size == 0) {
            return null;
        }

        Slot<HeapNode<T>> holeSlot = nodes.slot(1);
        T data = holeSlot.get().take();

        Slot<HeapNode<T>> lastSlot = nodes.slot(size);
        HeapNode<T> end = lastSlot.get();
        lastSlot.set(HeapNode.invalid());

        long hole = 1;
        while (hole * 2 + 1 <= size) {
            Slot<HeapNode<T>> leftSlot = nodes.slot(hole * 2);
            Slot<HeapNode<T>> rightSlot = nodes.slot(hole * 2 + 1);
            HeapNode<T> left = leftSlot.get();
            HeapNode<T> right = rightSlot.get();

            if (left.isValid() && right.isValid()) {
                if (ordering.less(end, left) && ordering.less(end, right)) {
                    break;
                }
                if (ordering.less(left, right)) {
                    holeSlot.set(left);
                    holeSlot = leftSlot;
                    hole = hole * 2;
                } else {
                    holeSlot.set(right);
                    holeSlot = rightSlot;
                    hole = hole * 2 + 1;
                }
            } else if (left.isValid()) {
                if (!ordering.less(end, left)) {
                    holeSlot.set(left);
                    holeSlot = leftSlot;
                }
                break;
            } else {
                break;
            }
        }

        holeSlot.set(end);
        nodes.popDiscard();

        return data;
    }

    /**
     * Visits every element in storage order, which is the breadth-first order
     * of the implicit tree and not sorted order.
     */
    public void iterate(NodeVisitor<? super T> visitor) {
        Objects.requireNonNull(visitor, "visitor cannot be null");
        long size = size();
        for (long i = 1; i <= size; ++i) {
            HeapNode<T> node = nodes.at(i);
            if (node.isValid()) {
                visitor.visit(node.priority(), node.data());
            }
        }
    }

    /**
     * Copies this heap, keeping its ordering and node layout. If the copy
     * function fails, the copies made so far are cleaned up before the
     * exception propagates.
     *
     * @see CloneStrategy
     */
    public PriorityHeap<T> clone(CloneStrategy<T> strategy) {
        Objects.requireNonNull(strategy, "strategy cannot be null");
        PriorityHeap<T> copy = new PriorityHeap<>(ordering);
        long size = size();
        try {
            for (long i = 1; i <= size; ++i) {
                HeapNode<T> node = nodes.at(i);
                copy.nodes.push(node.isValid()
                        ? HeapNode.of(node.priority(), strategy.duplicate(node.payload()))
                        : HeapNode.invalid());
            }
        } catch (RuntimeException e) {
            copy.close();
            throw e;
        }
        log.debugf("Cloned heap of %d nodes (%s)", size, strategy.isShallow() ? "shallow" : "deep");
        return copy;
    }

    /** Number of elements, excluding the sentinel. */
    public long size() {
        return Math.max(0, nodes.size() - 1);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public HeapOrdering<T> ordering() {
        return ordering;
    }

    /**
     * Runs the cleanup of every element still in the heap. Idempotent.
     */
    @Override
    public void close() {
        nodes.close();
    }
}
