package com.libragraph.stash.structures.map;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Sizing for {@link ChainedHashMap}.
 *
 * @param startBuckets initial bucket count; odd so that the growth step
 *                     {@code (n - 1) * 2 + 1} keeps it odd
 */
public record HashMapConfig(int startBuckets) {

    public static final String START_BUCKETS_KEY = "stash.hash-map.start-buckets";
    public static final int DEFAULT_START_BUCKETS = 33;

    public HashMapConfig {
        if (startBuckets < 3 || startBuckets % 2 == 0) {
            throw new IllegalArgumentException(
                    "startBuckets must be odd and >= 3, got: " + startBuckets);
        }
    }

    /**
     * Values resolved from the MicroProfile config of the current class loader.
     * Resolved once and cached.
     */
    public static HashMapConfig current() {
        return Holder.CURRENT;
    }

    /**
     * Reads sizing from {@code config}, falling back to the built-in defaults.
     *
     * @throws IllegalArgumentException if the configured value is invalid
     */
    public static HashMapConfig load(Config config) {
        int startBuckets = config.getOptionalValue(START_BUCKETS_KEY, Integer.class)
                .orElse(DEFAULT_START_BUCKETS);
        return new HashMapConfig(startBuckets);
    }

    private static final class Holder {
        static final HashMapConfig CURRENT = load(ConfigProvider.getConfig());
    }
}
