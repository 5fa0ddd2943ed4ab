/**
 * Sentinel-framed linked list used as the bucket chain of
 * {@link com.libragraph.stash.structures.map.ChainedHashMap}.
 */
package com.libragraph.stash.structures.list;
