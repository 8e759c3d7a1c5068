package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.ExecutionTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for execution history entries
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionLogResponse {

    private UUID id;
    private String functionName;
    private ExecutionTrigger trigger;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private Boolean success;
    private String errorMessage;
    private String errorType;
    private Map<String, Object> resultPayload;
}
