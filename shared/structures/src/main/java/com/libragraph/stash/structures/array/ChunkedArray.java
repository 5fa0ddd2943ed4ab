package com.libragraph.stash.structures.array;

import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Growable random-access storage made of fixed-size blocks of {@link #CHUNK_SIZE} slots.
 *
 * <p>Layout invariants:
 * <ul>
 *   <li>every block except the last is full</li>
 *   <li>the last block holds {@code lastBlockSize() ∈ [0, CHUNK_SIZE)} elements</li>
 *   <li>{@code size() == (blockCount() - 1) * CHUNK_SIZE + lastBlockSize()}</li>
 * </ul>
 *
 * Growth only reallocates the table of block references. Blocks already
 * allocated are never copied, so a {@link Slot} obtained before a push stays
 * bound to the same element afterwards.
 *
 * <p>The optional cleanup is applied to elements that the array discards:
 * on {@link #close()}, {@link #clear()}, {@link #popDiscard()} and
 * {@link #pop(boolean) pop(false)}.
 *
 * <p>Not thread-safe.
 */
public class ChunkedArray<T> implements AutoCloseable, Iterable<T> {

    private static final Logger log = Logger.getLogger(ChunkedArray.class);

    /** Slots per block. */
    public static final int CHUNK_SIZE = 32;

    private final Consumer<? super T> cleanup;

    private Object[][] blocks;
    private int blockCount;
    private int lastSize;

    /**
     * Creates an empty array with one allocated block.
     *
     * @param cleanup applied to discarded elements; {@code null} for none
     */
    public ChunkedArray(Consumer<? super T> cleanup) {
        this.cleanup = cleanup;
        reset();
    }

    public ChunkedArray() {
        this(null);
    }

    /**
     * Appends an element, allocating a new block when the last one fills.
     *
     * @throws IllegalStateException if the array has been closed
     */
    public void push(T value) {
        if (!isOpen()) {
            throw new IllegalStateException("Cannot push into a closed ChunkedArray");
        }

        blocks[blockCount - 1][lastSize] = value;
        ++lastSize;

        if (lastSize >= CHUNK_SIZE) {
            if (blockCount == blocks.length) {
                blocks = Arrays.copyOf(blocks, blocks.length + 1);
            }
            blocks[blockCount] = new Object[CHUNK_SIZE];
            ++blockCount;
            lastSize = 0;
            log.tracef("ChunkedArray grew to %d blocks", blockCount);
        }
    }

    /**
     * Returns the element at {@code index}, or {@code null} if out of range.
     */
    public T at(long index) {
        Slot<T> slot = slot(index);
        return slot != null ? slot.get() : null;
    }

    /**
     * Returns a stable handle on the element at {@code index}, or {@code null} if out of range.
     * The handle survives later pushes; it must not be used after the element is popped.
     */
    public Slot<T> slot(long index) {
        if (!isOpen() || index < 0) {
            return null;
        }

        long blockIndex = index / CHUNK_SIZE;
        int offset = (int) (index % CHUNK_SIZE);

        if (blockIndex >= blockCount) {
            return null;
        } else if (blockIndex + 1 == blockCount && offset >= lastSize) {
            return null;
        }

        return new Slot<>(blocks[(int) blockIndex], offset);
    }

    /**
     * Removes and returns the last element, or {@code null} if empty.
     *
     * @param skipCleanup if {@code false} the cleanup runs on the element before
     *                    it is returned; if {@code true} the caller takes ownership
     */
    public T pop(boolean skipCleanup) {
        T value = removeLast();
        if (value != null && !skipCleanup && cleanup != null) {
            cleanup.accept(value);
        }
        return value;
    }

    /**
     * Removes and returns the last element without running the cleanup.
     */
    public T pop() {
        return pop(true);
    }

    /**
     * Removes the last element and discards it through the cleanup.
     *
     * @return {@code true} if an element was removed
     */
    public boolean popDiscard() {
        if (isEmpty()) {
            return false;
        }
        T value = removeLast();
        if (value != null && cleanup != null) {
            cleanup.accept(value);
        }
        return true;
    }

    /**
     * Discards every element and returns to the freshly constructed state.
     * A closed array stays closed.
     */
    public void clear() {
        if (!isOpen()) {
            return;
        }
        close();
        reset();
    }

    /**
     * The element that the next {@link #pop()} would return, or {@code null} if empty.
     */
    public T top() {
        return isEmpty() ? null : at(size() - 1);
    }

    /**
     * The element at index 0, or {@code null} if empty.
     */
    public T bottom() {
        return isEmpty() ? null : at(0);
    }

    public long size() {
        if (!isOpen()) {
            return 0;
        }
        return (long) (blockCount - 1) * CHUNK_SIZE + lastSize;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Number of allocated blocks, including the partially filled last one. */
    public int blockCount() {
        return blockCount;
    }

    /** Fill level of the last block. */
    public int lastBlockSize() {
        return lastSize;
    }

    public boolean isOpen() {
        return blocks != null && blockCount > 0;
    }

    /**
     * Visits elements in index order.
     */
    @Override
    public void forEach(Consumer<? super T> action) {
        long size = size();
        for (long i = 0; i < size; ++i) {
            action.accept(at(i));
        }
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < size();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return at(next++);
            }
        };
    }

    /**
     * Runs the cleanup on every live element and releases all blocks.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!isOpen()) {
            return;
        }

        Object[][] old = blocks;
        int oldCount = blockCount;
        int oldLast = lastSize;
        blocks = null;
        blockCount = 0;
        lastSize = 0;

        if (cleanup == null) {
            return;
        }
        for (int b = 0; b < oldCount; ++b) {
            int limit = b + 1 == oldCount ? oldLast : CHUNK_SIZE;
            for (int i = 0; i < limit; ++i) {
                T value = elementOf(old[b], i);
                if (value != null) {
                    cleanup.accept(value);
                }
            }
        }
    }

    // -- internals --

    private void reset() {
        blocks = new Object[1][];
        blocks[0] = new Object[CHUNK_SIZE];
        blockCount = 1;
        lastSize = 0;
    }

    private T removeLast() {
        if (!isOpen()) {
            return null;
        }

        if (lastSize == 0) {
            if (blockCount <= 1) {
                return null;
            }
            blocks[blockCount - 1] = null;
            --blockCount;
            blocks = Arrays.copyOf(blocks, blockCount);
            lastSize = CHUNK_SIZE - 1;
            log.tracef("ChunkedArray shrank to %d blocks", blockCount);
        } else {
            --lastSize;
        }

        Object[] block = blocks[blockCount - 1];
        T value = elementOf(block, lastSize);
        block[lastSize] = null;
        return value;
    }

    @SuppressWarnings("unchecked")
    private static <T> T elementOf(Object[] block, int offset) {
        return (T) block[offset];
    }

    /**
     * Handle on one element's storage. Bound to the block, not to the table of
     * blocks, so it stays valid across growth of the array.
     */
    public static final class Slot<T> {

        private final Object[] block;
        private final int offset;

        private Slot(Object[] block, int offset) {
            this.block = block;
            this.offset = offset;
        }

        public T get() {
            return elementOf(block, offset);
        }

        public void set(T value) {
            block[offset] = value;
        }

        /** True if both handles address the same storage. */
        public boolean sameStorage(Slot<?> other) {
            return other != null && block == other.block && offset == other.offset;
        }
    }
}
