/**
 * Separate-chaining hash map keyed by byte arrays.
 *
 * <p>Buckets are {@link com.libragraph.stash.structures.list.SentinelList} chains.
 * The bucket count starts odd (see {@link com.libragraph.stash.structures.map.HashMapConfig})
 * and grows as {@code (n - 1) * 2 + 1}, rehashing every entry before the insert
 * that would bring the entry count up to the bucket count.
 */
package com.libragraph.stash.structures.map;
