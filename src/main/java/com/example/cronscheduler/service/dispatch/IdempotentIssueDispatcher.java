package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.client.ClientModels.IssueLabel;
import com.example.cronscheduler.client.ClientModels.IssueResponse;
import com.example.cronscheduler.client.IssueTrackerClient;
import com.example.cronscheduler.config.DispatchProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.dto.DispatchResult;
import com.example.cronscheduler.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Emits an incident as an issue at most once per fingerprint per retention window.
 * <p>
 * Flow:
 * 1. Fingerprint the incident
 * 2. Look the fingerprint up, returning a suppressed result if it was dispatched recently
 * 3. Create the issue through the retry policy
 * 4. Record the fingerprint with the configured retention
 * <p>
 * The idempotency store is advisory: if it cannot be read the dispatch goes
 * ahead, and if it cannot be written the created issue is still returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotentIssueDispatcher {

    private final IssueTrackerClient issueTrackerClient;
    private final IdempotencyStore idempotencyStore;
    private final IncidentFingerprinter fingerprinter;
    private final IssueContentBuilder contentBuilder;
    private final RetryPolicy issueRetryPolicy;
    private final DispatchProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Dispatch an incident.
     *
     * @param incident Incident with type, title and description set
     * @return Created issue, or the earlier issue when suppressed
     * @throws ExternalServiceException if the tracker is not configured, rejects the
     *                                  request, or keeps failing after retries
     */
    public DispatchResult dispatch(Incident incident) {
        if (!issueTrackerClient.isConfigured()) {
            throw ExternalServiceException.unavailable("GitHub", "GitHub token not configured");
        }

        var key = fingerprinter.fingerprint(incident, properties.getEnvironment());

        var existing = lookup(key);
        if (existing.isPresent()) {
            var record = existing.get();
            log.info("Suppressed duplicate incident {} (existing issue #{})", key, record.getIssueNumber());
            metricsConfig.recordDispatch("suppressed");
            return DispatchResult.builder()
                    .suppressed(true)
                    .number(record.getIssueNumber())
                    .url(record.getUrl())
                    .createdAt(record.getCreatedAt())
                    .idempotencyKey(key)
                    .build();
        }

        var requestId = incident.getRequestId() != null ? incident.getRequestId() : UUID.randomUUID().toString();
        var request = contentBuilder.build(incident, requestId);

        log.info("Creating issue '{}' with labels {} (key {})", request.getTitle(), request.getLabels(), key);

        IssueResponse issue;
        try {
            issue = issueRetryPolicy.execute(() -> issueTrackerClient.createIssue(request));
        } catch (RuntimeException e) {
            metricsConfig.recordDispatch("failed");
            throw e;
        }
        if (issue == null || issue.getNumber() == null) {
            metricsConfig.recordDispatch("failed");
            throw ExternalServiceException.unavailable("GitHub", "Issue creation returned no issue");
        }

        record(key, IdempotencyRecord.builder()
                .issueNumber(issue.getNumber())
                .url(issue.getHtmlUrl())
                .createdAt(clock.instant())
                .build());

        metricsConfig.recordDispatch("created");
        log.info("Created issue #{} {}", issue.getNumber(), issue.getHtmlUrl());

        return DispatchResult.builder()
                .suppressed(false)
                .number(issue.getNumber())
                .url(issue.getHtmlUrl())
                .title(issue.getTitle())
                .state(issue.getState())
                .labels(labelNames(issue))
                .idempotencyKey(key)
                .build();
    }

    private static List<String> labelNames(IssueResponse issue) {
        if (issue.getLabels() == null) {
            return List.of();
        }
        return issue.getLabels().stream().map(IssueLabel::getName).toList();
    }

    private Optional<IdempotencyRecord> lookup(String key) {
        try {
            return idempotencyStore.find(key);
        } catch (RuntimeException e) {
            log.warn("Idempotency check failed for {}, proceeding: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void record(String key, IdempotencyRecord record) {
        try {
            idempotencyStore.save(key, record, properties.getRetention());
        } catch (RuntimeException e) {
            log.error("Failed to record issue #{} for {}: {}", record.getIssueNumber(), key, e.getMessage());
        }
    }
}
