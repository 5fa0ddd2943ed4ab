package com.libragraph.stash.structures.map;

/**
 * Maps key bytes to a 64-bit hash. The result is treated as unsigned.
 */
@FunctionalInterface
public interface KeyHasher {

    /** Byte-folding hash over {@link com.libragraph.stash.util.LinearCongruential}. */
    KeyHasher DEFAULT = new DefaultKeyHasher();

    long hash(byte[] key);
}
