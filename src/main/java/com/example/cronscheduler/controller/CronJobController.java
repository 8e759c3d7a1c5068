package com.example.cronscheduler.controller;

import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.CreateJobRequest;
import com.example.cronscheduler.dto.ForcedRunResult;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.PassSummary;
import com.example.cronscheduler.dto.UpdateJobRequest;
import com.example.cronscheduler.service.CronJobManagementService;
import com.example.cronscheduler.service.job.JobFunctionRegistry;
import com.example.cronscheduler.service.runner.CronRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST API controller for cron jobs.
 * <p>
 * Provides endpoints for:
 * - Managing job definitions
 * - Running all due jobs, normally called by an outside scheduler
 * - Running a single job on demand
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/cron")
@Tag(name = "Cron Jobs", description = "APIs for managing and running cron jobs")
public class CronJobController {

    private final CronJobManagementService jobManagementService;
    private final CronRunService cronRunService;
    private final JobFunctionRegistry functionRegistry;

    // === Job Management ===

    @GetMapping("/jobs")
    @Operation(summary = "List jobs", description = "List cron jobs, optionally filtered by active flag and tenant")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs(
            @Parameter(description = "Active flag filter") @RequestParam(required = false) Boolean active,
            @Parameter(description = "Tenant filter") @RequestParam(required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs(active, tenantId)));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a cron job, optionally with its recent executions")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Include execution history")
            @RequestParam(defaultValue = "false") boolean includeHistory) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(jobId, includeHistory)));
    }

    @PostMapping("/jobs")
    @Operation(summary = "Create a job", description = "Create a cron job; its first run is computed from the schedule")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create cron job {} ({})", request.getName(), request.getFunctionName());

        var response = jobManagementService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Cron job created successfully"));
    }

    @PutMapping("/jobs/{jobId}")
    @Operation(summary = "Update a job", description = "Update fields of a cron job; changing the schedule recomputes the next run")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update cron job {}", jobId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.updateJob(jobId, request), "Cron job updated successfully"));
    }

    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Delete a job", description = "Delete a cron job and its execution history")
    public ResponseEntity<ApiResponse<Void>> deleteJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Delete cron job {}", jobId);

        jobManagementService.deleteJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(null, "Cron job deleted successfully"));
    }

    // === Execution ===

    @PostMapping("/run")
    @Operation(summary = "Run due jobs", description = "Execute every active job whose next run has passed")
    public ResponseEntity<ApiResponse<PassSummary>> runDueJobs() {
        log.info("API: Run due cron jobs");

        var summary = cronRunService.runDueJobs();
        return ResponseEntity.ok(ApiResponse.success(summary,
                String.format("Executed %d of %d due jobs", summary.getExecuted(), summary.getTotal())));
    }

    @PostMapping("/jobs/{jobId}/run")
    @Operation(summary = "Run a job now", description = "Execute a job immediately regardless of its schedule or active flag")
    public ResponseEntity<ApiResponse<ForcedRunResult>> runJobNow(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        log.info("API: Run cron job {} now", jobId);

        var result = cronRunService.runJobNow(jobId);
        var message = result.isSuccess()
                ? String.format("Job \"%s\" executed", result.getJob().getName())
                : String.format("Job \"%s\" failed: %s", result.getJob().getName(), result.getError());
        if (Boolean.TRUE.equals(result.getJobDeleted())) {
            message += " (job was deleted during the run)";
        }
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @GetMapping("/functions")
    @Operation(summary = "List job functions", description = "Names and aliases a job can reference as function_name")
    public ResponseEntity<ApiResponse<Set<String>>> listFunctions() {
        return ResponseEntity.ok(ApiResponse.success(functionRegistry.getRegisteredNames()));
    }
}
