package com.libragraph.stash.structures.heap;

/**
 * Orders heap nodes by their {@code long} priority.
 * Returns {@code true} if {@code a} belongs closer to the top than {@code b}.
 */
@FunctionalInterface
public interface PriorityLess {

    /** Smallest priority on top. */
    PriorityLess ASCENDING = (a, b) -> a < b;

    /** Largest priority on top. */
    PriorityLess DESCENDING = (a, b) -> a > b;

    boolean less(long a, long b);
}
