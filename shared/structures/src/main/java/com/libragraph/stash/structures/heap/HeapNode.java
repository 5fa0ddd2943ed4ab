package com.libragraph.stash.structures.heap;

import com.libragraph.stash.util.Owned;

/**
 * One slot of the heap's backing array. Invalid nodes fill the index-0
 * sentinel and vacated positions; they carry no payload.
 */
final class HeapNode<T> {

    private final long priority;
    private final Owned<T> payload;
    private boolean valid;

    private HeapNode(long priority, Owned<T> payload, boolean valid) {
        this.priority = priority;
        this.payload = payload;
        this.valid = valid;
    }

    static <T> HeapNode<T> of(long priority, Owned<T> payload) {
        return new HeapNode<>(priority, payload, true);
    }

    static <T> HeapNode<T> invalid() {
        return new HeapNode<>(0, null, false);
    }

    long priority() {
        return priority;
    }

    T data() {
        return valid ? payload.get() : null;
    }

    Owned<T> payload() {
        return payload;
    }

    boolean isValid() {
        return valid;
    }

    /**
     * Hands the payload to the caller without cleanup and invalidates the node.
     */
    T take() {
        if (!valid) {
            return null;
        }
        valid = false;
        return payload.release();
    }

    /**
     * Runs the payload cleanup if the node is still valid.
     */
    void destroy() {
        if (valid) {
            valid = false;
            payload.destroy();
        }
    }
}
