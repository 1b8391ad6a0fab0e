package com.ml.sentinel.monitor.test.core;

import com.ml.sentinel.monitor.core.InMemoryFastStateStore;
import com.ml.sentinel.monitor.test.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.ml.sentinel.monitor.test.support.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFastStateStoreTest {

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryFastStateStore store = new InMemoryFastStateStore("t:", clock);

    @Test
    void setIfAbsentHoldsUntilTtlElapses() {
        assertThat(store.setIfAbsent("k", "a", Duration.ofSeconds(10))).isTrue();
        assertThat(store.setIfAbsent("k", "b", Duration.ofSeconds(10))).isFalse();

        clock.advance(Duration.ofSeconds(10));
        assertThat(store.get("k")).isEmpty();
        assertThat(store.setIfAbsent("k", "b", Duration.ofSeconds(10))).isTrue();
        assertThat(store.get("k")).contains("b");
    }

    @Test
    void deleteIfValueOnlyRemovesOwnValue() {
        assertThat(store.setIfAbsent("k", "mine", Duration.ofMinutes(1))).isTrue();
        assertThat(store.deleteIfValue("k", "theirs")).isFalse();
        assertThat(store.get("k")).contains("mine");
        assertThat(store.deleteIfValue("k", "mine")).isTrue();
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void expiredValueCannotBeDeletedByItsOwner() {
        assertThat(store.setIfAbsent("k", "mine", Duration.ofSeconds(5))).isTrue();
        clock.advance(Duration.ofSeconds(6));
        assertThat(store.deleteIfValue("k", "mine")).isFalse();
    }

    @Test
    void zeroTtlNeverExpires() {
        assertThat(store.setIfAbsent("k", "v", Duration.ZERO)).isTrue();
        clock.advance(Duration.ofDays(365));
        assertThat(store.get("k")).contains("v");
        assertThat(store.setIfAbsent("k", "w", Duration.ZERO)).isFalse();
        assertThat(store.deleteIfValue("k", "v")).isTrue();
        assertThat(store.get("k")).isEmpty();
    }
}
