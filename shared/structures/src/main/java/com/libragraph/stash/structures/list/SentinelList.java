package com.libragraph.stash.structures.list;

import com.libragraph.stash.util.Owned;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Doubly linked list framed by two non-data sentinel nodes.
 *
 * Every live node owns its element through an {@link Owned} wrapper; removal
 * and {@link #close()} run the element's cleanup, {@link #drain(Consumer)}
 * moves elements out without running it.
 *
 * <p>Not thread-safe.
 */
public class SentinelList<T> implements AutoCloseable {

    private final Node<T> head = new Node<>(null);
    private final Node<T> tail = new Node<>(null);
    private int count;

    public SentinelList() {
        head.next = tail;
        tail.prev = head;
    }

    /**
     * Puts {@code data} at the front of the list.
     *
     * @param cleanup run when the node is removed or the list closed; {@code null} for none
     */
    public void addFront(T data, Consumer<? super T> cleanup) {
        linkAfter(head, new Node<>(Owned.of(data, cleanup)));
    }

    /**
     * Puts {@code data} at the end of the list.
     *
     * @param cleanup run when the node is removed or the list closed; {@code null} for none
     */
    public void add(T data, Consumer<? super T> cleanup) {
        linkAfter(tail.prev, new Node<>(Owned.of(data, cleanup)));
    }

    /**
     * Removes every element matching {@code match}, running each one's cleanup.
     *
     * @return number of removed elements
     */
    public int remove(Predicate<? super T> match) {
        Objects.requireNonNull(match, "match cannot be null");
        int removed = 0;
        Node<T> node = head.next;
        while (node != tail) {
            Node<T> next = node.next;
            if (match.test(node.payload.get())) {
                unlink(node);
                node.payload.destroy();
                ++removed;
            }
            node = next;
        }
        return removed;
    }

    /**
     * Removes the first element matching {@code match}, running its cleanup.
     *
     * @return {@code true} if an element was removed
     */
    public boolean removeOnce(Predicate<? super T> match) {
        Objects.requireNonNull(match, "match cannot be null");
        for (Node<T> node = head.next; node != tail; node = node.next) {
            if (match.test(node.payload.get())) {
                unlink(node);
                node.payload.destroy();
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first element matching {@code match}, or {@code null}.
     */
    public T get(Predicate<? super T> match) {
        Objects.requireNonNull(match, "match cannot be null");
        for (Node<T> node = head.next; node != tail; node = node.next) {
            T data = node.payload.get();
            if (match.test(data)) {
                return data;
            }
        }
        return null;
    }

    /**
     * Visits elements front to back. Stops at the first non-zero visitor result.
     *
     * @return the non-zero result that stopped the walk, or 0
     */
    public int forEach(ListVisitor<? super T> visitor) {
        Objects.requireNonNull(visitor, "visitor cannot be null");
        for (Node<T> node = head.next; node != tail; node = node.next) {
            int result = visitor.visit(node.payload.get());
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    /**
     * Hands every element to {@code sink} front to back and empties the list.
     * Cleanups are not run; the sink takes ownership.
     */
    public void drain(Consumer<? super T> sink) {
        Objects.requireNonNull(sink, "sink cannot be null");
        Node<T> node = head.next;
        head.next = tail;
        tail.prev = head;
        count = 0;
        while (node != tail) {
            Node<T> next = node.next;
            node.prev = null;
            node.next = null;
            sink.accept(node.payload.release());
            node = next;
        }
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Runs the cleanup of every live element and empties the list.
     */
    @Override
    public void close() {
        Node<T> node = head.next;
        head.next = tail;
        tail.prev = head;
        count = 0;
        while (node != tail) {
            Node<T> next = node.next;
            node.prev = null;
            node.next = null;
            node.payload.destroy();
            node = next;
        }
    }

    // -- internals --

    private void linkAfter(Node<T> anchor, Node<T> node) {
        node.prev = anchor;
        node.next = anchor.next;
        anchor.next.prev = node;
        anchor.next = node;
        ++count;
    }

    private void unlink(Node<T> node) {
        node.prev.next = node.next;
        node.next.prev = node.prev;
        node.prev = null;
        node.next = null;
        --count;
    }

    private static final class Node<T> {
        final Owned<T> payload;
        Node<T> prev;
        Node<T> next;

        Node(Owned<T> payload) {
            this.payload = payload;
        }
    }
}
