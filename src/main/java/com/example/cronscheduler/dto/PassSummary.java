package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one run-loop pass
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassSummary {

    /**
     * Due jobs selected by the pass
     */
    private int total;

    private int executed;

    /**
     * Jobs claimed by a concurrent pass
     */
    private int skipped;

    private int failed;

    private long durationMs;

    @Builder.Default
    private List<ExecutedJob> executedJobs = new ArrayList<>();

    @Builder.Default
    private List<FailedJob> failedJobs = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutedJob {
        private UUID id;
        private String name;
        private String functionName;
        private Instant nextRun;
        private Instant executedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailedJob {
        private UUID id;
        private String name;
        private String error;
    }
}
