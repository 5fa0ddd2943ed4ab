package com.libragraph.stash.structures.heap;

/**
 * Orders heap nodes by their payloads with a caller-supplied context that is
 * fixed when the heap is created.
 */
@FunctionalInterface
public interface ContextLess<T, C> {

    boolean less(T a, T b, C context);
}
