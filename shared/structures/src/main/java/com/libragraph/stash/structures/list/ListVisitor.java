package com.libragraph.stash.structures.list;

/**
 * Callback for {@link SentinelList#forEach(ListVisitor)}.
 * A non-zero return value stops the walk and is returned to the caller.
 */
@FunctionalInterface
public interface ListVisitor<T> {

    int visit(T data);
}
