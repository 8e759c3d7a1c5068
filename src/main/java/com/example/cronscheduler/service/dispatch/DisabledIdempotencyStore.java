package com.example.cronscheduler.service.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Store used when deduplication is switched off: nothing is ever a duplicate.
 */
@Slf4j
public class DisabledIdempotencyStore implements IdempotencyStore {

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        return Optional.empty();
    }

    @Override
    public void save(String key, IdempotencyRecord record, Duration ttl) {
        log.debug("Idempotency disabled, not recording {}", key);
    }
}
