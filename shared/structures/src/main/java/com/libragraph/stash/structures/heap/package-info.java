/**
 * Binary priority heap backed by {@link com.libragraph.stash.structures.array.ChunkedArray}.
 *
 * <p>A heap is created with one {@link com.libragraph.stash.structures.heap.HeapOrdering}:
 * by priority (default ascending), by payload, or by payload with a context.
 * {@link com.libragraph.stash.structures.heap.PriorityHeap#clone(CloneStrategy)} copies a heap
 * either sharing payloads ({@link com.libragraph.stash.structures.heap.CloneStrategy#shallow()})
 * or through a copy function ({@link com.libragraph.stash.structures.heap.CloneStrategy#deep}).
 */
package com.libragraph.stash.structures.heap;
