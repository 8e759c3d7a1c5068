package com.example.cronscheduler.service.job;

import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.service.store.JobStore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * What a job function gets to see about the job it runs for
 */
@Value
@Builder
public class JobContext {
    UUID jobId;
    String jobName;
    String tenantId;
    String functionName;
    JobMetadata metadata;
    JobStore jobStore;
    Instant now;
}
