package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.exception.IdempotencyStoreException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory idempotency store. Entries expire on their own after the TTL they were saved with.
 */
public class CaffeineIdempotencyStore implements IdempotencyStore {

    private final Cache<String, Entry> cache;

    public CaffeineIdempotencyStore() {
        this(Ticker.systemTicker());
    }

    CaffeineIdempotencyStore(Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryExpiry())
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        try {
            return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::record);
        } catch (RuntimeException e) {
            throw new IdempotencyStoreException("Lookup failed for " + key, e);
        }
    }

    @Override
    public void save(String key, IdempotencyRecord record, Duration ttl) {
        try {
            cache.put(key, new Entry(record, ttl.toNanos()));
        } catch (RuntimeException e) {
            throw new IdempotencyStoreException("Write failed for " + key, e);
        }
    }

    private record Entry(IdempotencyRecord record, long ttlNanos) {
    }

    private static class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
