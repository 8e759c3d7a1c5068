package com.example.cronscheduler.service.dispatch;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry expiry holding dispatched fingerprints.
 * <p>
 * Implementations throw {@link com.example.cronscheduler.exception.IdempotencyStoreException}
 * when the store cannot be reached; callers treat that as "not seen".
 */
public interface IdempotencyStore {

    Optional<IdempotencyRecord> find(String key);

    void save(String key, IdempotencyRecord record, Duration ttl);
}
