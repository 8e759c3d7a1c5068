package com.example.cronscheduler.service.runner;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.JobExecutionLog;
import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.domain.enums.ExecutionTrigger;
import com.example.cronscheduler.domain.repository.JobExecutionLogRepository;
import com.example.cronscheduler.domain.schedule.ScheduleEvaluator;
import com.example.cronscheduler.dto.ForcedRunResult;
import com.example.cronscheduler.dto.PassSummary;
import com.example.cronscheduler.exception.JobClaimConflictException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.mapper.JobMapper;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.job.JobContext;
import com.example.cronscheduler.service.job.JobFunctionRegistry;
import com.example.cronscheduler.service.job.JobResult;
import com.example.cronscheduler.service.store.JobPatch;
import com.example.cronscheduler.service.store.JobStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs cron jobs: every due job in a pass, or a single job on demand.
 * <p>
 * Per job in a pass:
 * 1. Compute the next run from the schedule
 * 2. Claim the job by writing last run, next run and execution count,
 *    conditional on the version read at selection
 * 3. Invoke the job function
 * 4. On failure record the error on the job, alerting once the error count reaches the threshold
 * 5. Write an execution history entry
 * <p>
 * The claim is written before the function runs, so a crash mid-execution
 * still advances the schedule. A job failure never fails the pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronRunService {

    private final JobStore jobStore;
    private final JobFunctionRegistry functionRegistry;
    private final ScheduleEvaluator scheduleEvaluator;
    private final JobExecutionLogRepository executionLogRepository;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final CronSchedulerProperties properties;
    private final JobMapper jobMapper;
    private final Clock clock;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    @PostConstruct
    void initInstanceId() {
        var pid = ProcessHandle.current().pid();
        try {
            instanceId = InetAddress.getLocalHost().getHostName() + "-" + pid;
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name, using HOSTNAME: {}", e.getMessage());
            instanceId = hostname + "-" + pid;
        }
        log.info("Cron runner instance id: {}", instanceId);
    }

    /**
     * Execute every job that is due now.
     *
     * @return Pass summary, including jobs that failed
     * @throws com.example.cronscheduler.exception.JobStoreException if due jobs cannot be fetched
     */
    public PassSummary runDueJobs() {
        var now = clock.instant();
        var dueJobs = jobStore.listDue(now);

        var summary = PassSummary.builder().total(dueJobs.size()).build();

        if (dueJobs.isEmpty()) {
            log.debug("No cron jobs due at {}", now);
        } else {
            log.info("Found {} cron jobs due", dueJobs.size());
        }

        for (var job : dueJobs) {
            try {
                runScheduled(job, now, summary);
            } catch (JobClaimConflictException e) {
                log.info("Cron job {} was claimed by another pass, skipping", job.getId());
                summary.setSkipped(summary.getSkipped() + 1);
            } catch (Exception e) {
                log.error("Error running cron job {} ({}): {}", job.getName(), job.getId(), e.getMessage(), e);
                addFailed(summary, job, e.getMessage());
            }
        }

        summary.setDurationMs(Duration.between(now, clock.instant()).toMillis());
        metricsConfig.recordPass(summary.getExecuted(), summary.getFailed(), summary.getSkipped());

        log.info("Cron pass finished: {} due, {} executed, {} failed, {} skipped in {}ms",
                summary.getTotal(), summary.getExecuted(), summary.getFailed(), summary.getSkipped(), summary.getDurationMs());
        return summary;
    }

    private void runScheduled(CronJob job, Instant now, PassSummary summary) {
        var nextRun = scheduleEvaluator.nextRun(job.getSchedule(), now);
        var metadata = job.getMetadata() != null ? job.getMetadata() : new JobMetadata();

        var claimed = jobStore.update(job.getId(), JobPatch.builder()
                .lastRun(now)
                .nextRun(nextRun)
                .metadataEntry(JobMetadata.LAST_EXECUTION, now)
                .metadataEntry(JobMetadata.EXECUTION_COUNT, metadata.getExecutionCount() + 1)
                .expectedVersion(job.getVersion())
                .build());

        if (claimed.isEmpty()) {
            log.warn("Cron job {} disappeared before it could be claimed", job.getId());
            summary.setSkipped(summary.getSkipped() + 1);
            return;
        }

        var current = claimed.get();
        var result = invoke(current, ExecutionTrigger.SCHEDULED, now);

        if (result.isSuccess()) {
            summary.setExecuted(summary.getExecuted() + 1);
            summary.getExecutedJobs().add(PassSummary.ExecutedJob.builder()
                    .id(current.getId())
                    .name(current.getName())
                    .functionName(current.getFunctionName())
                    .nextRun(nextRun)
                    .executedAt(now)
                    .build());
        } else {
            recordFailure(current, result, now);
            addFailed(summary, current, result.getErrorMessage());
        }
    }

    /**
     * Execute one job immediately, whatever its schedule or active flag, then reschedule it.
     *
     * @param jobId Job to run
     * @return Outcome of the run with the updated job, or with the job as loaded
     *         and {@code jobDeleted} set when it was deleted while running
     * @throws JobNotFoundException if the job does not exist
     */
    public ForcedRunResult runJobNow(UUID jobId) {
        var job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        var now = clock.instant();

        log.info("Manual run of cron job {} ({})", job.getName(), jobId);

        var result = invoke(job, ExecutionTrigger.MANUAL, now);
        var nextRun = scheduleEvaluator.nextRun(job.getSchedule(), now);
        var metadata = job.getMetadata() != null ? job.getMetadata() : new JobMetadata();

        var patch = JobPatch.builder()
                .lastRun(now)
                .nextRun(nextRun)
                .metadataEntry(JobMetadata.LAST_EXECUTION, now)
                .metadataEntry(JobMetadata.EXECUTION_COUNT, metadata.getExecutionCount() + 1);

        var errorCount = metadata.getErrorCount();
        if (!result.isSuccess()) {
            errorCount++;
            patch.metadataEntry(JobMetadata.LAST_ERROR, result.getErrorMessage())
                    .metadataEntry(JobMetadata.LAST_ERROR_AT, now)
                    .metadataEntry(JobMetadata.ERROR_COUNT, errorCount);
        }

        var updated = jobStore.update(jobId, patch.build());

        if (updated.isEmpty()) {
            log.warn("Cron job {} was deleted during its manual run, skipping bookkeeping", jobId);
        } else if (!result.isSuccess()) {
            alertIfThresholdReached(updated.get(), errorCount, result.getErrorMessage());
        }

        return ForcedRunResult.builder()
                .job(jobMapper.toResponse(updated.orElse(job)))
                .jobDeleted(updated.isEmpty() ? Boolean.TRUE : null)
                .success(result.isSuccess())
                .result(result.getData())
                .error(result.getErrorMessage())
                .nextRun(nextRun)
                .durationMs(Duration.between(now, clock.instant()).toMillis())
                .build();
    }

    private JobResult invoke(CronJob job, ExecutionTrigger trigger, Instant now) {
        var timerSample = metricsConfig.startJobExecutionTimer();
        var startTime = clock.instant();

        var context = JobContext.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .tenantId(job.getTenantId())
                .functionName(job.getFunctionName())
                .metadata(job.getMetadata() != null ? job.getMetadata().copy() : new JobMetadata())
                .jobStore(jobStore)
                .now(now)
                .build();

        var result = functionRegistry.execute(job.getFunctionName(), context);
        var endTime = clock.instant();

        metricsConfig.recordJobExecution(timerSample, job.getFunctionName(), result.isSuccess());
        if (result.isSuccess()) {
            log.info("Cron job {} ({}) completed in {}ms", job.getName(), job.getFunctionName(),
                    Duration.between(startTime, endTime).toMillis());
        } else {
            log.warn("Cron job {} ({}) failed: {}", job.getName(), job.getFunctionName(), result.getErrorMessage());
            metricsConfig.recordJobFailure(job.getFunctionName(), result.getErrorType());
        }

        saveExecutionLog(job, trigger, startTime, endTime, result);
        return result;
    }

    private void recordFailure(CronJob job, JobResult result, Instant now) {
        var errorCount = job.getMetadata().getErrorCount() + 1;

        var updated = jobStore.update(job.getId(), JobPatch.builder()
                .metadataEntry(JobMetadata.LAST_ERROR, result.getErrorMessage())
                .metadataEntry(JobMetadata.LAST_ERROR_AT, now)
                .metadataEntry(JobMetadata.ERROR_COUNT, errorCount)
                .build());

        updated.ifPresent(saved -> alertIfThresholdReached(saved, errorCount, result.getErrorMessage()));
    }

    private void alertIfThresholdReached(CronJob job, int errorCount, String errorMessage) {
        if (errorCount == properties.getFailureAlertThreshold()) {
            log.warn("Cron job {} reached {} errors, sending alert", job.getId(), errorCount);
            slackAlertService.sendJobFailureAlert(job, errorMessage);
        }
    }

    private void saveExecutionLog(CronJob job, ExecutionTrigger trigger, Instant startTime, Instant endTime, JobResult result) {
        var entry = JobExecutionLog.builder()
                .jobId(job.getId())
                .functionName(job.getFunctionName())
                .trigger(trigger)
                .executorInstance(instanceId)
                .startedAt(startTime)
                .completedAt(endTime)
                .durationMs(Duration.between(startTime, endTime).toMillis())
                .success(result.isSuccess())
                .errorMessage(result.getErrorMessage())
                .errorType(result.getErrorType())
                .resultPayload(result.getData())
                .build();

        try {
            executionLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to record execution history for job {}: {}", job.getId(), e.getMessage());
        }
    }

    private static void addFailed(PassSummary summary, CronJob job, String error) {
        summary.setFailed(summary.getFailed() + 1);
        summary.getFailedJobs().add(PassSummary.FailedJob.builder()
                .id(job.getId())
                .name(job.getName())
                .error(error)
                .build());
    }
}
