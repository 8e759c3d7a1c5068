package com.example.cronscheduler.service.dispatch;

import com.example.cronscheduler.client.ClientModels.CreateIssueRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an incident as an issue: title, labels and a markdown body.
 */
@Slf4j
public class IssueContentBuilder {

    private static final Map<String, List<String>> TYPE_LABELS = Map.of(
            "api", List.of("backend", "api-endpoint"),
            "mcp", List.of("mcp-server", "ai"),
            "system", List.of("infrastructure"));

    private static final Map<String, String> SEVERITY_MARKERS = Map.of(
            "critical", "🔴",
            "high", "🟠",
            "medium", "🟡",
            "low", "🟢");

    private final String environment;
    private final String buildVersion;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public IssueContentBuilder(String environment, String buildVersion, Clock clock, ObjectMapper objectMapper) {
        this.environment = environment;
        this.buildVersion = buildVersion;
        this.clock = clock;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public CreateIssueRequest build(Incident incident, String requestId) {
        return CreateIssueRequest.builder()
                .title(buildTitle(incident))
                .body(buildBody(incident, requestId))
                .labels(buildLabels(incident))
                .assignees(incident.getAssignee() != null && !incident.getAssignee().isBlank()
                        ? List.of(incident.getAssignee())
                        : List.of())
                .build();
    }

    /**
     * {@code [TYPE] title}, or {@code [DEV-TYPE] title} in the dev environment
     */
    String buildTitle(Incident incident) {
        var type = incident.getType().toUpperCase(Locale.ROOT);
        var prefix = "dev".equals(environment) ? "DEV-" + type : type;
        return "[" + prefix + "] " + incident.getTitle();
    }

    List<String> buildLabels(Incident incident) {
        var labels = new ArrayList<String>();
        labels.add("bug");
        labels.add("health-monitor");
        labels.add("env:" + environment);
        labels.add("source:health-monitor");

        labels.addAll(TYPE_LABELS.getOrDefault(incident.getType(), List.of()));

        var severity = incident.getSeverity();
        if ("critical".equals(severity)) {
            labels.add("priority:critical");
            labels.add("needs-immediate-attention");
        } else if ("high".equals(severity) || "medium".equals(severity) || "low".equals(severity)) {
            labels.add("priority:" + severity);
        }

        if (incident.getComponent() != null && !incident.getComponent().isBlank()) {
            labels.add("component:" + incident.getComponent().toLowerCase(Locale.ROOT));
        }
        return labels;
    }

    String buildBody(Incident incident, String requestId) {
        var timestamp = clock.instant().toString();
        var marker = incident.getSeverity() != null
                ? SEVERITY_MARKERS.getOrDefault(incident.getSeverity(), "⚪")
                : "⚪";

        var body = new StringBuilder();
        body.append("## ").append(marker).append(" Health Monitor Alert\n\n")
                .append("**Type:** ").append(incident.getType().toUpperCase(Locale.ROOT)).append("  \n")
                .append("**Component:** ").append(orDefault(incident.getComponent(), "Unknown")).append("  \n")
                .append("**Severity:** ").append(orDefault(incident.getSeverity(), "unknown")).append("  \n")
                .append("**Detected:** ").append(timestamp).append("\n\n")
                .append("---\n\n")
                .append("## Problem Description\n\n")
                .append(incident.getDescription()).append("\n\n");

        if (incident.getContext() != null && !incident.getContext().isEmpty()) {
            body.append("## Diagnostic Context\n\n")
                    .append("```json\n").append(toJson(incident.getContext())).append("\n```\n\n");
        }

        if (incident.getSuggestedFix() != null && !incident.getSuggestedFix().isBlank()) {
            body.append("## Suggested Fix\n\n").append(incident.getSuggestedFix()).append("\n\n");
        }

        body.append("---\n\n")
                .append("## Action Items\n\n")
                .append("- [ ] Review diagnostic information\n")
                .append("- [ ] Implement suggested fix\n")
                .append("- [ ] Add tests for regression prevention\n")
                .append("- [ ] Deploy and verify fix in staging\n")
                .append("- [ ] Update health monitoring if needed\n\n")
                .append("---\n\n")
                .append("## Monitoring Metadata\n\n")
                .append("| Field | Value |\n")
                .append("|-------|-------|\n")
                .append("| Environment | ").append(environment).append(" |\n")
                .append("| Build Version | ").append(buildVersion).append(" |\n")
                .append("| Request ID | ").append(requestId).append(" |\n")
                .append("| Generated | ").append(timestamp).append(" |\n\n")
                .append("---\n\n")
                .append("*This issue was created automatically by the health monitor.*\n");

        return body.toString();
    }

    /**
     * Comment asking the coding assistant to pick up an issue
     */
    public String buildReviewRequest(String additionalContext) {
        var body = new StringBuilder();
        body.append("🤖 **GitHub Copilot Review Requested**\n\n")
                .append("@github-copilot please analyze this issue and:\n")
                .append("1. Review the diagnostic information and suggested fix\n")
                .append("2. Implement the fix with comprehensive error handling\n")
                .append("3. Add tests to prevent regression\n")
                .append("4. Create a PR for review\n\n");

        if (additionalContext != null && !additionalContext.isBlank()) {
            body.append("**Additional Context:**\n").append(additionalContext).append("\n\n");
        }

        body.append("---\n")
                .append("*This is an automated request from the health monitor.*\n");
        return body.toString();
    }

    private String toJson(Map<String, Object> context) {
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.warn("Could not render incident context as JSON: {}", e.getMessage());
            return String.valueOf(context);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
