package com.libragraph.stash.structures.map;

import com.libragraph.stash.structures.list.SentinelList;
import com.libragraph.stash.util.Owned;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Hash map with byte-array keys and separate chaining.
 *
 * <p>The map takes ownership of every key and value handed to
 * {@link #insert(Object, byte[], Consumer, Consumer) insert}, including ones it
 * rejects: their cleanups run when the entry is removed, when the map is
 * closed, or immediately on rejection. Callers must not mutate a key array
 * after inserting it.
 *
 * <p>{@code null} is never stored as a value, so a {@code null} from
 * {@link #get(byte[])} always means "absent".
 *
 * <p>Not thread-safe.
 */
public class ChainedHashMap<V> implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ChainedHashMap.class);

    private final KeyHasher hasher;
    private SentinelList<Entry<V>>[] buckets;
    private int count;

    public ChainedHashMap() {
        this(KeyHasher.DEFAULT);
    }

    public ChainedHashMap(KeyHasher hasher) {
        this(hasher, HashMapConfig.current().startBuckets());
    }

    /**
     * @param startBuckets initial bucket count, odd and at least 3
     */
    public ChainedHashMap(KeyHasher hasher, int startBuckets) {
        this.hasher = Objects.requireNonNull(hasher, "hasher cannot be null");
        this.buckets = newBuckets(new HashMapConfig(startBuckets).startBuckets());
    }

    /**
     * Inserts {@code value} under {@code key}. The new entry is placed in front
     * of its bucket chain; an existing entry with the same key is not replaced.
     *
     * @param valueCleanup run on the value when the entry is discarded; {@code null} for none
     * @param keyCleanup   run on the key when the entry is discarded; {@code null} for none
     * @return {@code true} if stored; {@code false} if rejected, in which case
     * the cleanups have already been run
     * @throws IllegalStateException if the map has been closed
     */
    public boolean insert(V value, byte[] key,
                          Consumer<? super V> valueCleanup,
                          Consumer<? super byte[]> keyCleanup) {
        Owned<V> ownedValue = Owned.of(value, valueCleanup);
        Owned<byte[]> ownedKey = Owned.of(key, keyCleanup);

        if (value == null || key == null) {
            log.warnf("Rejected insert: %s is null", value == null ? "value" : "key");
            ownedValue.destroy();
            ownedKey.destroy();
            return false;
        }
        if (buckets == null) {
            ownedValue.destroy();
            ownedKey.destroy();
            throw new IllegalStateException("Cannot insert into a closed ChainedHashMap");
        }

        if (count + 1 >= buckets.length) {
            rehash();
        }

        bucketFor(key).addFront(new Entry<>(ownedKey, ownedValue), Entry::destroy);
        ++count;
        return true;
    }

    public boolean insert(V value, byte[] key) {
        return insert(value, key, null, null);
    }

    /**
     * Returns the value stored under a key of equal length and content, or {@code null}.
     */
    public V get(byte[] key) {
        if (key == null || buckets == null) {
            return null;
        }
        Entry<V> entry = bucketFor(key).get(e -> e.matches(key));
        return entry != null ? entry.value.get() : null;
    }

    public boolean containsKey(byte[] key) {
        return get(key) != null;
    }

    /**
     * Removes every entry stored under {@code key}, running their cleanups.
     * More than one match means the map holds duplicate keys; that case is
     * reported separately and logged.
     */
    public RemoveResult remove(byte[] key) {
        if (key == null || buckets == null) {
            return RemoveResult.NOT_FOUND;
        }

        int removed = bucketFor(key).remove(e -> e.matches(key));
        count -= removed;

        if (removed == 0) {
            return RemoveResult.NOT_FOUND;
        } else if (removed == 1) {
            return RemoveResult.REMOVED;
        }
        log.warnf("Removed %d entries sharing one key of %d bytes", removed, key.length);
        return RemoveResult.REMOVED_MULTIPLE;
    }

    /**
     * Visits every entry once, bucket by bucket. Within a bucket, the most
     * recently inserted entry comes first.
     *
     * @return 0 after a full pass, otherwise the first non-zero visitor result
     */
    public int iterate(EntryVisitor<? super V> visitor) {
        Objects.requireNonNull(visitor, "visitor cannot be null");
        if (buckets == null) {
            return 0;
        }
        for (SentinelList<Entry<V>> bucket : buckets) {
            int result = bucket.forEach(e -> visitor.visit(e.key.get(), e.value.get()));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    /** Number of live entries. */
    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public int bucketCount() {
        return buckets != null ? buckets.length : 0;
    }

    /**
     * Runs the cleanups of every entry and releases the buckets. Idempotent.
     */
    @Override
    public void close() {
        if (buckets == null) {
            return;
        }
        SentinelList<Entry<V>>[] old = buckets;
        buckets = null;
        count = 0;
        for (SentinelList<Entry<V>> bucket : old) {
            bucket.close();
        }
    }

    // -- internals --

    private SentinelList<Entry<V>> bucketFor(byte[] key) {
        long hash = hasher.hash(key);
        return buckets[(int) Long.remainderUnsigned(hash, buckets.length)];
    }

    /**
     * Moves every entry into a bucket array of size {@code (n - 1) * 2 + 1}.
     * Entries are drained from the old chains, so their cleanups do not run
     * when the old chains are closed.
     */
    private void rehash() {
        long grown = (long) (buckets.length - 1) * 2 + 1;
        if (grown > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("ChainedHashMap cannot grow beyond " + buckets.length + " buckets");
        }

        SentinelList<Entry<V>>[] old = buckets;
        buckets = newBuckets((int) grown);
        for (SentinelList<Entry<V>> chain : old) {
            chain.drain(entry -> bucketFor(entry.key.get()).addFront(entry, Entry::destroy));
            chain.close();
        }
        log.debugf("Rehashed %d entries: %d -> %d buckets", count, old.length, buckets.length);
    }

    @SuppressWarnings("unchecked")
    private static <E> SentinelList<Entry<E>>[] newBuckets(int size) {
        SentinelList<Entry<E>>[] result = (SentinelList<Entry<E>>[]) new SentinelList<?>[size];
        for (int i = 0; i < size; ++i) {
            result[i] = new SentinelList<>();
        }
        return result;
    }

    private static final class Entry<V> {
        final Owned<byte[]> key;
        final Owned<V> value;

        Entry(Owned<byte[]> key, Owned<V> value) {
            this.key = key;
            this.value = value;
        }

        boolean matches(byte[] candidate) {
            return Arrays.equals(key.get(), candidate);
        }

        void destroy() {
            value.destroy();
            key.destroy();
        }
    }
}
