package com.example.cronscheduler.client;

import com.example.cronscheduler.client.ClientModels.CommentResponse;
import com.example.cronscheduler.client.ClientModels.CreateCommentRequest;
import com.example.cronscheduler.client.ClientModels.CreateIssueRequest;
import com.example.cronscheduler.client.ClientModels.IssueResponse;

/**
 * Outbound issue creation and commenting.
 */
public interface IssueTrackerClient {

    /**
     * Create one issue. A single attempt; retrying is the caller's decision.
     *
     * @throws com.example.cronscheduler.exception.ExternalServiceException on any failure
     */
    IssueResponse createIssue(CreateIssueRequest request);

    /**
     * Comment on an existing issue. A single attempt, like {@link #createIssue}.
     */
    CommentResponse addComment(int issueNumber, CreateCommentRequest request);

    /**
     * Whether credentials and target repository are configured
     */
    boolean isConfigured();
}
