package com.libragraph.stash.structures.map;

/**
 * Callback for {@link ChainedHashMap#iterate(EntryVisitor)}.
 * A non-zero return value stops the iteration and becomes its result.
 * The key array belongs to the map and must not be modified.
 */
@FunctionalInterface
public interface EntryVisitor<V> {

    int visit(byte[] key, V value);
}
