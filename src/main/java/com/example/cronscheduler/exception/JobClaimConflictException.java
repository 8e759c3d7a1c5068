package com.example.cronscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a conditional job update finds the record changed since it was read,
 * meaning another pass already claimed this run.
 */
@Getter
public class JobClaimConflictException extends RuntimeException {

    private final UUID jobId;
    private final Long expectedVersion;

    public JobClaimConflictException(UUID jobId, Long expectedVersion) {
        super(String.format("Job %s was modified concurrently (expected version %s)", jobId, expectedVersion));
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
    }
}
