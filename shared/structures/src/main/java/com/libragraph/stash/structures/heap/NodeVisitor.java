package com.libragraph.stash.structures.heap;

/**
 * Callback for {@link PriorityHeap#iterate(NodeVisitor)}.
 */
@FunctionalInterface
public interface NodeVisitor<T> {

    void visit(long priority, T data);
}
