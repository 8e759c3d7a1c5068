package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for asking the coding assistant to review an existing issue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {

    @NotNull(message = "issueNumber is required")
    @Positive(message = "issueNumber must be positive")
    @JsonAlias("issue_number")
    private Integer issueNumber;

    /**
     * Free text appended to the comment
     */
    @JsonAlias("additional_context")
    private String additionalContext;
}
