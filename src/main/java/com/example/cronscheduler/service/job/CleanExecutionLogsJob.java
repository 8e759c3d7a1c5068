package com.example.cronscheduler.service.job;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.repository.JobExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Deletes execution history older than a retention window.
 * <p>
 * Metadata (optional):
 * - retention_days: days of history to keep, defaults to the configured retention
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanExecutionLogsJob implements JobFunction {

    static final String RETENTION_DAYS = "retention_days";

    private final JobExecutionLogRepository executionLogRepository;
    private final CronSchedulerProperties properties;

    @Override
    public String getName() {
        return "cleanExecutionLogs";
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("clean_execution_logs");
    }

    @Override
    @Transactional
    public JobResult execute(JobContext context) {
        var retentionDays = context.getMetadata().getInt(RETENTION_DAYS, properties.getExecutionLogRetentionDays());
        if (retentionDays < 1) {
            return JobResult.failure("retention_days must be at least 1, got " + retentionDays, "INVALID_METADATA");
        }

        var cutoff = context.getNow().minus(Duration.ofDays(retentionDays));
        var deleted = executionLogRepository.deleteOlderThan(cutoff);

        log.info("Deleted {} execution log entries older than {} ({} days)", deleted, cutoff, retentionDays);

        return JobResult.success(Map.of(
                "deleted", deleted,
                "cutoff", cutoff.toString(),
                "retention_days", retentionDays
        ));
    }
}
