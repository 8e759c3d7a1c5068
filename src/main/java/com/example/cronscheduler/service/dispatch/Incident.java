package com.example.cronscheduler.service.dispatch;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Something worth raising an issue for.
 * {@code type}, {@code title} and {@code description} are required.
 */
@Value
@Builder
public class Incident {
    String type;
    String title;
    String description;
    Map<String, Object> context;
    String suggestedFix;
    String severity;
    String component;
    String assignee;
    String requestId;
}
