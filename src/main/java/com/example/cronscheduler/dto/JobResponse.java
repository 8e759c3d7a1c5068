package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.entity.JobMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private String tenantId;
    private String name;
    private String schedule;
    private String functionName;
    private boolean active;
    private Instant nextRun;
    private Instant lastRun;
    private JobMetadata metadata;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Execution history (populated on detail requests)
     */
    private List<JobExecutionLogResponse> executionHistory;
}
