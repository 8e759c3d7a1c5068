package com.example.cronscheduler.service;

import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.domain.repository.JobExecutionLogRepository;
import com.example.cronscheduler.domain.schedule.ScheduleAlias;
import com.example.cronscheduler.domain.schedule.ScheduleEvaluator;
import com.example.cronscheduler.dto.CreateJobRequest;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.UpdateJobRequest;
import com.example.cronscheduler.exception.InvalidJobException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.mapper.JobMapper;
import com.example.cronscheduler.service.job.JobFunctionRegistry;
import com.example.cronscheduler.service.store.JobFilter;
import com.example.cronscheduler.service.store.JobPatch;
import com.example.cronscheduler.service.store.JobStore;
import com.example.cronscheduler.service.store.NewJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for managing cron job definitions.
 * <p>
 * Provides:
 * - Job creation with required field validation
 * - Listing and retrieval with execution history
 * - Partial updates, rescheduling when the schedule changes
 * - Deletion
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronJobManagementService {

    static final String REQUIRED_FIELDS_MESSAGE = "name, schedule, and function_name are required";

    private final JobStore jobStore;
    private final JobExecutionLogRepository executionLogRepository;
    private final JobFunctionRegistry functionRegistry;
    private final ScheduleEvaluator scheduleEvaluator;
    private final JobMapper jobMapper;
    private final Clock clock;

    // === Creation ===

    public JobResponse createJob(CreateJobRequest request) {
        if (isBlank(request.getName()) || isBlank(request.getSchedule()) || isBlank(request.getFunctionName())) {
            throw new InvalidJobException(REQUIRED_FIELDS_MESSAGE);
        }

        rejectInvalidMetadata(request.getMetadata());
        warnOnUnknownReferences(request.getSchedule(), request.getFunctionName());

        var job = jobStore.create(NewJob.builder()
                .tenantId(request.getTenantId())
                .name(request.getName().trim())
                .schedule(request.getSchedule().trim())
                .functionName(request.getFunctionName().trim())
                .active(request.getActive() == null || request.getActive())
                .nextRun(scheduleEvaluator.nextRun(request.getSchedule().trim(), clock.instant()))
                .metadata(request.getMetadata())
                .build());

        log.info("Created cron job {} ({}) with schedule {}", job.getName(), job.getId(), job.getSchedule());
        return jobMapper.toResponse(job);
    }

    // === Retrieval ===

    public List<JobResponse> listJobs(Boolean active, String tenantId) {
        return jobMapper.toResponseList(jobStore.list(JobFilter.builder()
                .active(active)
                .tenantId(tenantId)
                .build()));
    }

    public JobResponse getJob(UUID jobId, boolean includeHistory) {
        var job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        var response = jobMapper.toResponse(job);
        if (includeHistory) {
            response.setExecutionHistory(jobMapper.toLogResponses(
                    executionLogRepository.findTop20ByJobIdOrderByStartedAtDesc(jobId)));
        }
        return response;
    }

    // === Update and deletion ===

    public JobResponse updateJob(UUID jobId, UpdateJobRequest request) {
        if (request == null || request.isEmpty()) {
            throw new InvalidJobException("No fields to update");
        }
        rejectBlank("name", request.getName());
        rejectBlank("schedule", request.getSchedule());
        rejectBlank("function_name", request.getFunctionName());

        var patch = JobPatch.builder()
                .name(trim(request.getName()))
                .functionName(trim(request.getFunctionName()))
                .active(request.getActive());

        if (request.getSchedule() != null) {
            var schedule = request.getSchedule().trim();
            patch.schedule(schedule).nextRun(scheduleEvaluator.nextRun(schedule, clock.instant()));
        }
        if (request.getMetadata() != null) {
            rejectInvalidMetadata(request.getMetadata());
            patch.metadata(request.getMetadata());
        }

        warnOnUnknownReferences(request.getSchedule(), request.getFunctionName());

        var job = jobStore.update(jobId, patch.build()).orElseThrow(() -> new JobNotFoundException(jobId));
        log.info("Updated cron job {} ({})", job.getName(), jobId);
        return jobMapper.toResponse(job);
    }

    public void deleteJob(UUID jobId) {
        if (!jobStore.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Deleted cron job {}", jobId);
    }

    private void warnOnUnknownReferences(String schedule, String functionName) {
        if (schedule != null && !ScheduleAlias.isKnown(schedule.trim())) {
            log.warn("Schedule '{}' is not recognised, the job will run every 5 minutes", schedule);
        }
        if (functionName != null && !functionRegistry.hasFunction(functionName.trim())) {
            log.warn("No job function registered as '{}', runs will fail until one is", functionName);
        }
    }

    /**
     * Bookkeeping keys in caller metadata must hold values of their own type:
     * counts as integers, timestamps as ISO-8601 instants or epoch millis.
     */
    private static void rejectInvalidMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            return;
        }
        try {
            JobMetadata.of(metadata);
        } catch (DateTimeException | NumberFormatException e) {
            throw new InvalidJobException("Invalid metadata: " + e.getMessage());
        }
    }

    private static void rejectBlank(String field, String value) {
        if (value != null && value.isBlank()) {
            throw new InvalidJobException(field + " must not be blank");
        }
    }

    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
