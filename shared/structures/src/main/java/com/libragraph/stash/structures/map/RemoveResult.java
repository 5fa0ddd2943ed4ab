package com.libragraph.stash.structures.map;

/**
 * Outcome of {@link ChainedHashMap#remove(byte[])}.
 */
public enum RemoveResult {
    /** Exactly one entry matched and was removed. */
    REMOVED,
    /** More than one entry matched the key and all were removed. Indicates duplicate keys. */
    REMOVED_MULTIPLE,
    NOT_FOUND;

    public boolean removedAny() {
        return this != NOT_FOUND;
    }
}
