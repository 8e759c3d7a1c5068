package com.example.cronscheduler.config;

import com.example.cronscheduler.domain.repository.CronJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the run loop and the incident dispatcher.
 * <p>
 * Exposes Prometheus metrics for:
 * - Active and due job counts
 * - Job execution times by function
 * - Pass outcomes
 * - Dispatch outcomes (created, suppressed, failed)
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final CronJobRepository jobRepository;
    private final Clock clock;

    private final AtomicLong activeJobs = new AtomicLong(0);
    private final AtomicLong dueJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("cron_jobs_active", activeJobs, AtomicLong::get)
                .description("Number of active cron jobs")
                .register(meterRegistry);

        Gauge.builder("cron_jobs_due", dueJobs, AtomicLong::get)
                .description("Number of active cron jobs currently due")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauge values from the database
     */
    @Scheduled(fixedDelayString = "${cron-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            activeJobs.set(jobRepository.countByActiveTrue());
            dueJobs.set(jobRepository.countDueJobs(clock.instant()));
        } catch (Exception e) {
            log.warn("Failed to refresh job gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time
     */
    public void recordJobExecution(Timer.Sample sample, String functionName, boolean success) {
        sample.stop(Timer.builder("cron_job_execution_time")
                .tag("function", functionName)
                .tag("success", String.valueOf(success))
                .description("Job function execution time")
                .register(meterRegistry));
    }

    public void recordJobFailure(String functionName, String errorType) {
        meterRegistry.counter("cron_job_failures",
                "function", functionName,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record a completed run-loop pass
     */
    public void recordPass(int executed, int failed, int skipped) {
        meterRegistry.counter("cron_pass_total").increment();
        meterRegistry.counter("cron_pass_jobs", "outcome", "executed").increment(executed);
        meterRegistry.counter("cron_pass_jobs", "outcome", "failed").increment(failed);
        meterRegistry.counter("cron_pass_jobs", "outcome", "skipped").increment(skipped);
    }

    /**
     * Record an incident dispatch outcome
     */
    public void recordDispatch(String outcome) {
        meterRegistry.counter("cron_dispatch_total", "outcome", outcome).increment();
    }
}
