package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a job.
 * Required fields are checked by the service so that every missing field
 * produces the same configuration error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @JsonAlias("tenant_id")
    @Size(max = 100)
    private String tenantId;

    @Size(max = 200)
    private String name;

    /**
     * Schedule alias or cron-style expression, e.g. {@code hourly} or {@code 0 0 * * *}
     */
    @Size(max = 100)
    private String schedule;

    @JsonAlias("function_name")
    @Size(max = 100)
    private String functionName;

    /**
     * Defaults to active
     */
    @JsonAlias("is_active")
    private Boolean active;

    /**
     * Job-specific configuration passed to the function
     */
    private Map<String, Object> metadata;
}
