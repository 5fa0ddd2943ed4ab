package com.libragraph.stash.structures.heap;

/**
 * Orders heap nodes by their payloads.
 * Returns {@code true} if {@code a} belongs closer to the top than {@code b}.
 */
@FunctionalInterface
public interface DataLess<T> {

    boolean less(T a, T b);
}
