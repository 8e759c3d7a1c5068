package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.client.ClientModels.CreateCommentRequest;
import com.example.cronscheduler.client.IssueTrackerClient;
import com.example.cronscheduler.dto.ReviewRequestResult;
import com.example.cronscheduler.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Posts a review request comment on an existing issue, asking the coding
 * assistant to analyze it and open a fix PR.
 * <p>
 * Not deduplicated: every call adds a comment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssueReviewRequester {

    private final IssueTrackerClient issueTrackerClient;
    private final IssueContentBuilder contentBuilder;
    private final RetryPolicy issueRetryPolicy;

    /**
     * @throws ExternalServiceException if the tracker is not configured, rejects the
     *                                  comment, or keeps failing after retries
     */
    public ReviewRequestResult requestReview(int issueNumber, String additionalContext) {
        if (!issueTrackerClient.isConfigured()) {
            throw ExternalServiceException.unavailable("GitHub", "GitHub token not configured");
        }

        var request = new CreateCommentRequest(contentBuilder.buildReviewRequest(additionalContext));
        var comment = issueRetryPolicy.execute(() -> issueTrackerClient.addComment(issueNumber, request));
        if (comment == null || comment.getId() == null) {
            throw ExternalServiceException.unavailable("GitHub", "Comment creation returned no comment");
        }

        log.info("Requested review on issue #{} (comment {})", issueNumber, comment.getId());
        return ReviewRequestResult.builder()
                .issueNumber(issueNumber)
                .commentId(comment.getId())
                .url(comment.getHtmlUrl())
                .build();
    }
}
