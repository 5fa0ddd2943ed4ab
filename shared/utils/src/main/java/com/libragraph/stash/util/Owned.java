package com.libragraph.stash.util;

import java.util.function.Consumer;

/**
 * A value together with the cleanup that releases it.
 *
 * Containers hold their payloads through this wrapper so that removal and
 * teardown have exactly one place where cleanup happens:
 * <ul>
 *   <li>{@link #destroy()} runs the cleanup at most once</li>
 *   <li>{@link #release()} hands the value to the caller and disarms the cleanup</li>
 *   <li>{@link #borrowed(Object)} wraps a value the holder does not own</li>
 * </ul>
 * After either {@code destroy()} or {@code release()} the wrapper is spent and
 * {@link #get()} returns {@code null}.
 */
public final class Owned<T> {

    private static final Consumer<Object> NO_CLEANUP = value -> { };

    private T value;
    private final Consumer<? super T> cleanup;
    private final boolean borrowed;
    private boolean spent;

    private Owned(T value, Consumer<? super T> cleanup, boolean borrowed) {
        this.value = value;
        this.cleanup = cleanup;
        this.borrowed = borrowed;
    }

    /**
     * Wraps an owned value.
     *
     * @param cleanup run on {@link #destroy()}; {@code null} means nothing to release
     */
    public static <T> Owned<T> of(T value, Consumer<? super T> cleanup) {
        return new Owned<>(value, cleanup != null ? cleanup : NO_CLEANUP, false);
    }

    /**
     * Wraps a value whose lifetime belongs to someone else. Destroying it is a no-op.
     */
    public static <T> Owned<T> borrowed(T value) {
        return new Owned<>(value, NO_CLEANUP, true);
    }

    public T get() {
        return value;
    }

    /** The cleanup this wrapper would run. Never null. */
    public Consumer<? super T> cleanup() {
        return cleanup;
    }

    public boolean isBorrowed() {
        return borrowed;
    }

    public boolean isSpent() {
        return spent;
    }

    /**
     * Transfers ownership to the caller. The cleanup will not run.
     *
     * @return the wrapped value, or {@code null} if already spent
     */
    public T release() {
        T out = value;
        value = null;
        spent = true;
        return out;
    }

    /**
     * Runs the cleanup on the wrapped value if it has not been released or destroyed.
     */
    public void destroy() {
        if (spent) {
            return;
        }
        T out = value;
        value = null;
        spent = true;
        if (out != null) {
            cleanup.accept(out);
        }
    }

    @Override
    public String toString() {
        return spent ? "Owned[spent]" : "Owned[" + value + (isBorrowed() ? ", borrowed]" : "]");
    }
}
