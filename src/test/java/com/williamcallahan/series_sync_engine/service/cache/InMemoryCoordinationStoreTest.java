package com.williamcallahan.series_sync_engine.service.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCoordinationStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private final InMemoryCoordinationStore store = new InMemoryCoordinationStore(nanos::get);

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    void valuesExpireAfterTheirOwnTtl() {
        store.set("short", "1", Duration.ofSeconds(5));
        store.set("long", "2", Duration.ofSeconds(60));

        advance(Duration.ofSeconds(10));

        assertThat(store.get("short")).isEmpty();
        assertThat(store.get("long")).contains("2");
    }

    @Test
    void setIfAbsentOnlyWinsOnce() {
        assertThat(store.setIfAbsent("lock", "a", Duration.ofSeconds(30))).isTrue();
        assertThat(store.setIfAbsent("lock", "b", Duration.ofSeconds(30))).isFalse();
        assertThat(store.get("lock")).contains("a");
    }

    @Test
    void setOverwritesAndRestartsTtl() {
        store.set("k", "old", Duration.ofSeconds(5));
        advance(Duration.ofSeconds(4));
        store.set("k", "new", Duration.ofSeconds(5));
        advance(Duration.ofSeconds(4));

        assertThat(store.get("k")).contains("new");
    }

    @Test
    void deleteRemovesValue() {
        store.set("k", "v", Duration.ofMinutes(1));
        store.delete("k");

        assertThat(store.get("k")).isEmpty();
    }
}
