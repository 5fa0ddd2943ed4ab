package com.libragraph.stash.structures.map;

import com.libragraph.stash.util.LinearCongruential;

/**
 * Folds each key byte into a running seed: add the unsigned byte value, XOR
 * with one of three mixing constants chosen by {@code index % 3}, then advance
 * the seed one {@link LinearCongruential} step. The final seed gets one more
 * step before it is returned.
 */
final class DefaultKeyHasher implements KeyHasher {

    private static final long[] MIX = {
            0x9E3779B97F4A7C15L,
            0xC2B2AE3D27D4EB4FL,
            0x165667B19E3779F9L
    };

    @Override
    public long hash(byte[] key) {
        long seed = 0;
        for (int i = 0; i < key.length; ++i) {
            seed += key[i] & 0xFF;
            seed ^= MIX[i % 3];
            seed = LinearCongruential.next(seed);
        }
        return LinearCongruential.next(seed);
    }
}
