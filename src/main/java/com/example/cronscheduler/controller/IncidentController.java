package com.example.cronscheduler.controller;

import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.CreateIncidentRequest;
import com.example.cronscheduler.dto.DispatchResult;
import com.example.cronscheduler.dto.ReviewRequest;
import com.example.cronscheduler.dto.ReviewRequestResult;
import com.example.cronscheduler.service.dispatch.IdempotentIssueDispatcher;
import com.example.cronscheduler.service.dispatch.Incident;
import com.example.cronscheduler.service.dispatch.IssueReviewRequester;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Raises incidents as GitHub issues, at most once per fingerprint per retention window
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Deduplicated incident reporting")
public class IncidentController {

    private final IdempotentIssueDispatcher dispatcher;
    private final IssueReviewRequester reviewRequester;

    @PostMapping
    @Operation(summary = "Raise an incident",
            description = "Creates an issue, or returns the existing one when an equivalent incident was raised recently")
    public ResponseEntity<ApiResponse<DispatchResult>> createIncident(
            @Valid @RequestBody CreateIncidentRequest request,
            @RequestHeader(name = "X-Request-Id", required = false) String requestId) {
        log.info("API: Raise {} incident '{}'", request.getType(), request.getTitle());

        var result = dispatcher.dispatch(Incident.builder()
                .type(request.getType())
                .title(request.getTitle())
                .description(request.getDescription())
                .context(request.getContext())
                .suggestedFix(request.getSuggestedFix())
                .severity(request.getSeverity())
                .component(request.getComponent())
                .assignee(request.getAssignee())
                .requestId(requestId)
                .build());

        if (result.isSuppressed()) {
            return ResponseEntity.ok(ApiResponse.success(result, "Duplicate incident suppressed"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(result, "Issue created successfully"));
    }

    @PostMapping("/assign-copilot")
    @Operation(summary = "Request an automated fix",
            description = "Comments on an existing issue asking the coding assistant to analyze it and open a PR")
    public ResponseEntity<ApiResponse<ReviewRequestResult>> requestReview(@Valid @RequestBody ReviewRequest request) {
        log.info("API: Request review on issue #{}", request.getIssueNumber());
        var result = reviewRequester.requestReview(request.getIssueNumber(), request.getAdditionalContext());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(result, "Review requested"));
    }
}
