package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a manual "run now" on a single job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForcedRunResult {

    private JobResponse job;
    private boolean success;
    private Map<String, Object> result;
    private String error;
    private Instant nextRun;
    private long durationMs;

    /**
     * Set when the job was deleted while it ran; {@code job} then shows it as loaded before the run
     */
    private Boolean jobDeleted;
}
