package com.example.cronscheduler.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request/Response DTOs for the issue tracker client
 */
public class ClientModels {
    private ClientModels() {
    }

    // === GitHub Issues ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class CreateIssueRequest {
        private String title;
        private String body;
        private List<String> labels;
        private List<String> assignees;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IssueResponse {
        private Integer number;
        @JsonProperty("html_url")
        private String htmlUrl;
        private String title;
        private String state;
        private List<IssueLabel> labels;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IssueLabel {
        private String name;
    }

    // === Issue comments ===

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateCommentRequest {
        private String body;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CommentResponse {
        private Long id;
        @JsonProperty("html_url")
        private String htmlUrl;
    }
}
