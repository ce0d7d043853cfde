/**
 * Caffeine-backed {@link CoordinationStore} for single-process deployments and tests
 *
 * @author William Callahan
 *
 * Features:
 * - Per-entry expiry through a Caffeine {@link Expiry}
 * - Atomic set-if-absent through the cache's map view
 */

package com.williamcallahan.series_sync_engine.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

public class InMemoryCoordinationStore implements CoordinationStore {

    private final Cache<String, Entry> entries;

    public InMemoryCoordinationStore() {
        this(Ticker.systemTicker());
    }

    public InMemoryCoordinationStore(Ticker ticker) {
        this.entries = Caffeine.newBuilder()
            .ticker(ticker)
            .expireAfter(new EntryExpiry())
            .maximumSize(100_000)
            .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, ttl));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Entry candidate = new Entry(value, ttl);
        return entries.asMap().putIfAbsent(key, candidate) == null;
    }

    @Override
    public void delete(String key) {
        entries.invalidate(key);
    }

    private record Entry(String value, Duration ttl) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
