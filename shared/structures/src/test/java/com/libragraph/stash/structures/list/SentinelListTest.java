package com.libragraph.stash.structures.list;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SentinelListTest {

    private List<String> cleaned;
    private SentinelList<String> list;

    @BeforeEach
    void setUp() {
        cleaned = new ArrayList<>();
        list = new SentinelList<>();
    }

    private List<String> contents() {
        List<String> out = new ArrayList<>();
        list.forEach(data -> {
            out.add(data);
            return 0;
        });
        return out;
    }

    @Test
    void shouldStartEmpty() {
        assertThat(list.isEmpty()).isTrue();
        assertThat(list.size()).isZero();
        assertThat(contents()).isEmpty();
        assertThat(list.get(s -> true)).isNull();
    }

    @Test
    void shouldPrependAndAppend() {
        list.add("b", cleaned::add);
        list.addFront("a", cleaned::add);
        list.add("c", cleaned::add);

        assertThat(contents()).containsExactly("a", "b", "c");
        assertThat(list.size()).isEqualTo(3);
    }

    @Test
    void shouldRemoveEveryMatchAndCleanUp() {
        list.add("x", cleaned::add);
        list.add("keep", cleaned::add);
        list.add("x", cleaned::add);
        list.add("x", cleaned::add);

        int removed = list.remove("x"::equals);

        assertThat(removed).isEqualTo(3);
        assertThat(cleaned).containsExactly("x", "x", "x");
        assertThat(contents()).containsExactly("keep");
        assertThat(list.size()).isEqualTo(1);
    }

    @Test
    void shouldReportZeroWhenNothingMatches() {
        list.add("a", cleaned::add);

        assertThat(list.remove("z"::equals)).isZero();
        assertThat(cleaned).isEmpty();
    }

    @Test
    void shouldRemoveOnlyFirstMatch() {
        list.add("x", cleaned::add);
        list.add("x", cleaned::add);

        assertThat(list.removeOnce("x"::equals)).isTrue();
        assertThat(list.size()).isEqualTo(1);
        assertThat(cleaned).hasSize(1);
        assertThat(list.removeOnce("y"::equals)).isFalse();
    }

    @Test
    void shouldGetFirstMatch() {
        list.add("apple", null);
        list.add("avocado", null);

        assertThat(list.get(s -> s.startsWith("a"))).isEqualTo("apple");
        assertThat(list.get(s -> s.startsWith("b"))).isNull();
    }

    @Test
    void shouldStopWalkOnNonZeroResult() {
        list.add("a", null);
        list.add("b", null);
        list.add("c", null);

        List<String> seen = new ArrayList<>();
        int result = list.forEach(data -> {
            seen.add(data);
            return data.equals("b") ? 42 : 0;
        });

        assertThat(result).isEqualTo(42);
        assertThat(seen).containsExactly("a", "b");
    }

    @Test
    void shouldDrainWithoutCleanup() {
        list.add("a", cleaned::add);
        list.add("b", cleaned::add);

        List<String> moved = new ArrayList<>();
        list.drain(moved::add);
        list.close();

        assertThat(moved).containsExactly("a", "b");
        assertThat(cleaned).isEmpty();
        assertThat(list.isEmpty()).isTrue();
    }

    @Test
    void shouldCleanUpOnClose() {
        list.add("a", cleaned::add);
        list.add("b", null);
        list.add("c", cleaned::add);

        list.close();

        assertThat(cleaned).containsExactly("a", "c");
        assertThat(list.size()).isZero();

        list.add("d", cleaned::add);
        assertThat(contents()).containsExactly("d");
    }
}
