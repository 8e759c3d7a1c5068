package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for raising an incident
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateIncidentRequest {

    /**
     * api, mcp or system
     */
    @NotBlank(message = "type is required")
    private String type;

    @NotBlank(message = "title is required")
    private String title;

    @NotBlank(message = "description is required")
    private String description;

    /**
     * Diagnostic context rendered as JSON in the issue body
     */
    private Map<String, Object> context;

    @JsonAlias("suggested_fix")
    private String suggestedFix;

    /**
     * critical, high, medium or low
     */
    private String severity;

    private String component;

    private String assignee;
}
