package com.example.cronscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of an incident dispatch: a freshly created issue, or a suppressed duplicate
 * pointing at the issue created earlier for the same fingerprint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DispatchResult {

    private boolean suppressed;
    private Integer number;
    private String url;
    private String title;
    private String state;
    private List<String> labels;
    private String idempotencyKey;

    /**
     * When the original issue was created, set on suppressed results
     */
    private Instant createdAt;
}
