package com.example.cronscheduler.service.job;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.service.dispatch.Incident;
import com.example.cronscheduler.service.dispatch.IdempotentIssueDispatcher;
import com.example.cronscheduler.service.store.JobFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Raises a deduplicated incident for every active job that keeps failing.
 * <p>
 * Metadata (optional):
 * - error_threshold: error count from which a job is reported, default 3
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportFailingJobsJob implements JobFunction {

    static final String ERROR_THRESHOLD = "error_threshold";
    static final int DEFAULT_ERROR_THRESHOLD = 3;

    private final IdempotentIssueDispatcher dispatcher;

    @Override
    public String getName() {
        return "reportFailingJobs";
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("report_failing_jobs");
    }

    @Override
    public JobResult execute(JobContext context) {
        var threshold = context.getMetadata().getInt(ERROR_THRESHOLD, DEFAULT_ERROR_THRESHOLD);

        var failing = context.getJobStore().list(JobFilter.builder().active(true).build()).stream()
                .filter(job -> !Objects.equals(job.getId(), context.getJobId()))
                .filter(job -> job.getMetadata() != null && job.getMetadata().getErrorCount() >= threshold)
                .toList();

        if (failing.isEmpty()) {
            log.debug("No jobs at or above {} errors", threshold);
            return JobResult.success(Map.of("failing", 0, "created", 0, "suppressed", 0));
        }

        var created = 0;
        var suppressed = 0;
        var errors = new ArrayList<String>();

        for (var job : failing) {
            try {
                var result = dispatcher.dispatch(toIncident(job));
                if (result.isSuppressed()) {
                    suppressed++;
                } else {
                    created++;
                }
            } catch (Exception e) {
                log.error("Failed to report failing job {}: {}", job.getId(), e.getMessage());
                errors.add(job.getName() + ": " + e.getMessage());
            }
        }

        log.info("Reported {} failing jobs: {} created, {} suppressed, {} errors",
                failing.size(), created, suppressed, errors.size());

        if (!errors.isEmpty()) {
            return JobResult.failure("Failed to report " + errors.size() + " job(s): " + String.join("; ", errors), "DISPATCH_FAILED")
                    .withData("created", created)
                    .withData("suppressed", suppressed);
        }
        return JobResult.success(Map.of("failing", failing.size(), "created", created, "suppressed", suppressed));
    }

    private Incident toIncident(CronJob job) {
        var metadata = job.getMetadata();

        var details = new LinkedHashMap<String, Object>();
        details.put("job_id", job.getId().toString());
        details.put("function_name", job.getFunctionName());
        details.put("schedule", job.getSchedule());
        details.put("error_count", metadata.getErrorCount());
        details.put("execution_count", metadata.getExecutionCount());
        if (job.getTenantId() != null) {
            details.put("tenant_id", job.getTenantId());
        }

        return Incident.builder()
                .type("system")
                .component("cron")
                .severity("high")
                .title("Cron job failing: " + job.getName())
                .description(String.format("Cron job %s (%s) has failed %d times. Last error: %s",
                        job.getName(), job.getFunctionName(), metadata.getErrorCount(),
                        metadata.getLastError() != null ? metadata.getLastError() : "unknown"))
                .context(details)
                .suggestedFix("Check the job function logs and its metadata configuration, then force a run to verify.")
                .build();
    }
}
