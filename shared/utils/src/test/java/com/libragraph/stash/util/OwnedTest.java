package com.libragraph.stash.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OwnedTest {

    @Test
    void shouldRunCleanupOnceOnDestroy() {
        List<String> released = new ArrayList<>();
        Owned<String> owned = Owned.of("payload", released::add);

        owned.destroy();
        owned.destroy();

        assertThat(released).containsExactly("payload");
        assertThat(owned.isSpent()).isTrue();
        assertThat(owned.get()).isNull();
    }

    @Test
    void shouldNotRunCleanupAfterRelease() {
        List<String> released = new ArrayList<>();
        Owned<String> owned = Owned.of("payload", released::add);

        assertThat(owned.release()).isEqualTo("payload");
        owned.destroy();

        assertThat(released).isEmpty();
        assertThat(owned.release()).isNull();
    }

    @Test
    void shouldTreatNullCleanupAsNoOp() {
        Owned<String> owned = Owned.of("payload", null);

        assertThat(owned.cleanup()).isNotNull();
        assertThat(owned.isBorrowed()).isFalse();
        assertThatCode(owned::destroy).doesNotThrowAnyException();
    }

    @Test
    void shouldSkipCleanupForNullValue() {
        List<Object> released = new ArrayList<>();
        Owned<Object> owned = Owned.of(null, released::add);

        owned.destroy();

        assertThat(released).isEmpty();
    }

    @Test
    void shouldNeverCleanUpBorrowedValue() {
        StringBuilder shared = new StringBuilder("shared");
        Owned<StringBuilder> borrowed = Owned.borrowed(shared);

        borrowed.destroy();

        assertThat(borrowed.isBorrowed()).isTrue();
        assertThat(shared).hasToString("shared");
    }

    @Test
    void shouldPropagateCleanupFailure() {
        Owned<String> owned = Owned.of("payload", value -> {
            throw new IllegalStateException("boom: " + value);
        });

        assertThatIllegalStateException()
                .isThrownBy(owned::destroy)
                .withMessageContaining("payload");
        assertThat(owned.isSpent()).isTrue();
    }

    @Test
    void shouldDescribeState() {
        Owned<String> owned = Owned.borrowed("x");
        assertThat(owned.toString()).isEqualTo("Owned[x, borrowed]");

        Owned<String> real = Owned.of("y", v -> { });
        assertThat(real.toString()).isEqualTo("Owned[y]");
        real.destroy();
        assertThat(real.toString()).isEqualTo("Owned[spent]");
    }
}
