package com.example.cronscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#oncall-alerts";
    private boolean enabled = true;

    /**
     * Base URL used to link alerts to the job admin view
     */
    private String dashboardBaseUrl = "http://localhost:8080/api/v1/cron";
}
