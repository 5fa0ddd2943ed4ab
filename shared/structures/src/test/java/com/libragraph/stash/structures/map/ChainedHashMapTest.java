package com.libragraph.stash.structures.map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ChainedHashMapTest {

    private ChainedHashMap<String> map;

    @BeforeEach
    void setUp() {
        map = new ChainedHashMap<>(KeyHasher.DEFAULT, 33);
    }

    private static byte[] intKey(int value) {
        return ByteBuffer.allocate(Integer.BYTES).putInt(value).array();
    }

    private static byte[] key(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldGetInsertedValues() {
        for (int i = 0; i < 20; ++i) {
            assertThat(map.insert("value-" + i, intKey(i))).isTrue();
        }

        for (int i = 0; i < 20; ++i) {
            assertThat(map.get(intKey(i))).isEqualTo("value-" + i);
        }
        assertThat(map.size()).isEqualTo(20);
        assertThat(map.get(intKey(20))).isNull();
    }

    @Test
    void shouldCompareKeysByLengthAndContent() {
        map.insert("abc", key("abc"));

        assertThat(map.get(key("abc"))).isEqualTo("abc");
        assertThat(map.get(key("ab"))).isNull();
        assertThat(map.get(key("abcd"))).isNull();
        assertThat(map.containsKey(key("abc"))).isTrue();
        assertThat(map.get(null)).isNull();
    }

    @Test
    void shouldRemoveOnlyTargetedKey() {
        for (int i = 0; i < 10; ++i) {
            map.insert("value-" + i, intKey(i));
        }

        assertThat(map.remove(intKey(4))).isEqualTo(RemoveResult.REMOVED);

        assertThat(map.get(intKey(4))).isNull();
        for (int i = 0; i < 10; ++i) {
            if (i != 4) {
                assertThat(map.get(intKey(i))).isEqualTo("value-" + i);
            }
        }
        assertThat(map.size()).isEqualTo(9);
        assertThat(map.remove(intKey(4))).isEqualTo(RemoveResult.NOT_FOUND);
        assertThat(RemoveResult.NOT_FOUND.removedAny()).isFalse();
    }

    @Test
    void shouldReportDuplicateKeysOnRemove() {
        List<String> cleaned = new ArrayList<>();
        map.insert("first", key("dup"), cleaned::add, null);
        map.insert("second", key("dup"), cleaned::add, null);

        assertThat(map.get(key("dup"))).isEqualTo("second");
        assertThat(map.size()).isEqualTo(2);

        RemoveResult result = map.remove(key("dup"));

        assertThat(result).isEqualTo(RemoveResult.REMOVED_MULTIPLE);
        assertThat(result.removedAny()).isTrue();
        assertThat(cleaned).containsExactlyInAnyOrder("first", "second");
        assertThat(map.size()).isZero();
    }

    @Test
    void shouldRehashWhenCountWouldReachBucketCount() {
        for (int i = 0; i < 32; ++i) {
            map.insert("value-" + i, intKey(i));
        }
        assertThat(map.bucketCount()).isEqualTo(33);

        map.insert("value-32", intKey(32));

        assertThat(map.bucketCount()).isEqualTo(65);
        assertThat(map.size()).isEqualTo(33);
        for (int i = 0; i <= 32; ++i) {
            assertThat(map.get(intKey(i))).isEqualTo("value-" + i);
        }
    }

    @Test
    void shouldKeepBucketCountOddAcrossGrowth() {
        for (int i = 0; i < 500; ++i) {
            map.insert("value-" + i, intKey(i));
        }

        assertThat(map.bucketCount()).isEqualTo(513);
        assertThat(map.bucketCount() % 2).isEqualTo(1);
        for (int i = 0; i < 500; ++i) {
            assertThat(map.get(intKey(i))).isEqualTo("value-" + i);
        }
    }

    @Test
    void shouldNotCleanUpEntriesWhileRehashing() {
        List<String> cleaned = new ArrayList<>();
        for (int i = 0; i < 100; ++i) {
            map.insert("value-" + i, intKey(i), cleaned::add, null);
        }

        assertThat(map.bucketCount()).isGreaterThan(33);
        assertThat(cleaned).isEmpty();

        map.close();
        assertThat(cleaned).hasSize(100);
    }

    @Test
    void shouldRejectNullValueAndReleaseKey() {
        List<byte[]> releasedKeys = new ArrayList<>();
        byte[] k = key("orphan");

        boolean stored = map.insert(null, k, null, releasedKeys::add);

        assertThat(stored).isFalse();
        assertThat(releasedKeys).containsExactly(k);
        assertThat(map.size()).isZero();
        assertThat(map.get(k)).isNull();
    }

    @Test
    void shouldRejectNullKeyAndReleaseValue() {
        List<String> releasedValues = new ArrayList<>();

        boolean stored = map.insert("orphan", null, releasedValues::add, null);

        assertThat(stored).isFalse();
        assertThat(releasedValues).containsExactly("orphan");
    }

    @Test
    void shouldRunValueAndKeyCleanupsOnRemove() {
        List<Object> released = new ArrayList<>();
        byte[] k = key("k");
        map.insert("v", k, released::add, released::add);

        map.remove(key("k"));

        assertThat(released).containsExactly("v", k);
    }

    @Test
    void shouldVisitEveryEntryOnce() {
        for (int i = 0; i < 50; ++i) {
            map.insert("value-" + i, intKey(i));
        }

        Set<String> seen = new HashSet<>();
        List<String> order = new ArrayList<>();
        int result = map.iterate((k, v) -> {
            seen.add(v);
            order.add(v);
            assertThat(ByteBuffer.wrap(k).getInt()).isEqualTo(Integer.parseInt(v.substring(6)));
            return 0;
        });

        assertThat(result).isZero();
        assertThat(order).hasSize(50);
        assertThat(seen).hasSize(50);
    }

    @Test
    void shouldStopIterationOnNonZeroResult() {
        for (int i = 0; i < 50; ++i) {
            map.insert("value-" + i, intKey(i));
        }

        int[] visits = {0};
        int result = map.iterate((k, v) -> ++visits[0] == 5 ? -7 : 0);

        assertThat(result).isEqualTo(-7);
        assertThat(visits[0]).isEqualTo(5);
    }

    @Test
    void shouldChainCollidingKeys() {
        ChainedHashMap<String> colliding = new ChainedHashMap<>(k -> 7L, 33);
        for (int i = 0; i < 10; ++i) {
            colliding.insert("value-" + i, intKey(i));
        }

        for (int i = 0; i < 10; ++i) {
            assertThat(colliding.get(intKey(i))).isEqualTo("value-" + i);
        }
        assertThat(colliding.remove(intKey(3))).isEqualTo(RemoveResult.REMOVED);
        assertThat(colliding.get(intKey(3))).isNull();
        assertThat(colliding.get(intKey(4))).isEqualTo("value-4");
    }

    @Test
    void shouldHandleNegativeHashes() {
        ChainedHashMap<String> negative = new ChainedHashMap<>(k -> -1L, 33);
        negative.insert("v", key("k"));

        assertThat(negative.get(key("k"))).isEqualTo("v");
    }

    @Test
    void shouldCleanUpEverythingOnClose() {
        List<String> cleaned = new ArrayList<>();
        map.insert("a", key("a"), cleaned::add, null);
        map.insert("b", key("b"), cleaned::add, null);

        map.close();
        map.close();

        assertThat(cleaned).containsExactlyInAnyOrder("a", "b");
        assertThat(map.size()).isZero();
        assertThat(map.bucketCount()).isZero();
        assertThat(map.get(key("a"))).isNull();
        assertThat(map.remove(key("a"))).isEqualTo(RemoveResult.NOT_FOUND);
    }

    @Test
    void shouldRejectInsertAfterCloseAndReleasePayload() {
        List<String> cleaned = new ArrayList<>();
        map.close();

        assertThatIllegalStateException()
                .isThrownBy(() -> map.insert("late", key("late"), cleaned::add, null))
                .withMessageContaining("closed");
        assertThat(cleaned).containsExactly("late");
    }

    @Test
    void shouldUseConfiguredStartBuckets() {
        ChainedHashMap<String> configured = new ChainedHashMap<>();

        assertThat(configured.bucketCount()).isEqualTo(HashMapConfig.current().startBuckets());
    }

    @Test
    void shouldRejectEvenStartBuckets() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ChainedHashMap<String>(KeyHasher.DEFAULT, 32))
                .withMessageContaining("odd");
    }
}
