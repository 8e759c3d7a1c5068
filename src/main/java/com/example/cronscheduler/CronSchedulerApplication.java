package com.example.cronscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cron Scheduler Service Application
 * <p>
 * Runs recurring jobs stored in PostgreSQL and raises deduplicated
 * incidents as GitHub issues.
 * <p>
 * Features:
 * - Schedule aliases evaluated in a configurable zone
 * - Version-based claim so overlapping passes never run a job twice
 * - Execution history per job
 * - Slack alerting when a job keeps failing
 * - Idempotent issue creation with retry and backoff
 */
@EnableScheduling
@SpringBootApplication
public class CronSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronSchedulerApplication.class, args);
    }
}
