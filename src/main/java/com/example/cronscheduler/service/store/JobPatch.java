package com.example.cronscheduler.service.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Partial update of a job. Null fields are left untouched.
 */
@Value
@Builder(toBuilder = true)
public class JobPatch {

    String name;
    String schedule;
    String functionName;
    Boolean active;
    Instant nextRun;
    Instant lastRun;

    /**
     * Entries merged into the existing metadata
     */
    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * When set, the update only applies if the stored version still matches
     */
    Long expectedVersion;

    public boolean isEmpty() {
        return name == null && schedule == null && functionName == null && active == null
                && nextRun == null && lastRun == null && metadata.isEmpty();
    }
}
