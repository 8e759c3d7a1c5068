package com.example.cronscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the cron scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cron-scheduler")
public class CronSchedulerProperties {

    /**
     * Zone in which hourly, daily and weekly boundaries are computed
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * Error count at which a job failure alert is sent
     */
    @Min(1)
    private int failureAlertThreshold = 3;

    /**
     * Default retention for execution history cleanup
     */
    @Min(1)
    private int executionLogRetentionDays = 30;

    @Valid
    private Poller poller = new Poller();

    @Data
    public static class Poller {

        /**
         * Run due jobs on a fixed delay from inside the service.
         * Off by default: passes are normally triggered over HTTP by an outside scheduler.
         */
        private boolean enabled = false;

        @Min(1000)
        private long intervalMs = 60000;
    }
}
