package com.example.cronscheduler.service.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A validated job definition ready to be persisted
 */
@Value
@Builder
public class NewJob {
    String tenantId;
    String name;
    String schedule;
    String functionName;
    @Builder.Default
    boolean active = true;
    Instant nextRun;
    Map<String, Object> metadata;
}
