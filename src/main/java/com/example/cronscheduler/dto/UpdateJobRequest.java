package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update of a job, null fields are left unchanged.
 * Metadata entries are merged into the existing metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    @Size(max = 200)
    private String name;

    @Size(max = 100)
    private String schedule;

    @JsonAlias("function_name")
    @Size(max = 100)
    private String functionName;

    @JsonAlias("is_active")
    private Boolean active;

    private Map<String, Object> metadata;

    public boolean isEmpty() {
        return name == null && schedule == null && functionName == null && active == null
                && (metadata == null || metadata.isEmpty());
    }
}
