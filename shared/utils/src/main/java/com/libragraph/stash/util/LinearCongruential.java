package com.libragraph.stash.util;

/**
 * 64-bit linear congruential step: {@code next = seed * a + c}.
 *
 * <p>The modulus is implicitly 2^64; Java's wrapping {@code long} arithmetic
 * gives the same bit pattern as unsigned 64-bit arithmetic, so callers may
 * treat the result as unsigned.
 */
public final class LinearCongruential {

    /** Default multiplier. */
    public static final long DEFAULT_A = 0x9ABDL;

    /** Default increment. */
    public static final long DEFAULT_C = 0x2A9A9A9L;

    private LinearCongruential() {
    }

    public static long next(long seed, long a, long c) {
        return seed * a + c;
    }

    /**
     * Advances {@code seed} with {@link #DEFAULT_A} and {@link #DEFAULT_C}.
     */
    public static long next(long seed) {
        return seed * DEFAULT_A + DEFAULT_C;
    }
}
