package com.example.cronscheduler.controller;

import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.dto.CreateJobRequest;
import com.example.cronscheduler.dto.ForcedRunResult;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.PassSummary;
import com.example.cronscheduler.dto.UpdateJobRequest;
import com.example.cronscheduler.exception.InvalidJobException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.exception.JobStoreException;
import com.example.cronscheduler.service.CronJobManagementService;
import com.example.cronscheduler.service.job.JobFunctionRegistry;
import com.example.cronscheduler.service.runner.CronRunService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CronJobController.class)
@DisplayName("CronJobController Tests")
class CronJobControllerTest {

    private static final UUID JOB_ID = UUID.fromString("7d6c1f0e-58e2-4b43-9a7e-3c1f2a9b8d10");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CronJobManagementService jobManagementService;

    @MockBean
    private CronRunService cronRunService;

    @MockBean
    private JobFunctionRegistry functionRegistry;

    private static JobResponse job() {
        return JobResponse.builder()
                .id(JOB_ID)
                .name("Nightly cleanup")
                .schedule("daily")
                .functionName("cleanExecutionLogs")
                .active(true)
                .nextRun(Instant.parse("2024-06-13T00:00:00Z"))
                .version(0L)
                .build();
    }

    @Nested
    @DisplayName("Job management")
    class ManagementTests {

        @Test
        @DisplayName("Should create a job and answer 201")
        void shouldCreateJob() throws Exception {
            when(jobManagementService.createJob(any(CreateJobRequest.class))).thenReturn(job());

            mockMvc.perform(post("/api/v1/cron/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"name": "Nightly cleanup", "schedule": "daily", "function_name": "cleanExecutionLogs"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value(JOB_ID.toString()))
                    .andExpect(jsonPath("$.data.nextRun").value("2024-06-13T00:00:00Z"));
        }

        @Test
        @DisplayName("Should answer 400 when required fields are missing")
        void shouldRejectIncompleteJob() throws Exception {
            when(jobManagementService.createJob(any(CreateJobRequest.class)))
                    .thenThrow(new InvalidJobException("name, schedule, and function_name are required"));

            mockMvc.perform(post("/api/v1/cron/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\": \"No schedule\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.message").value("name, schedule, and function_name are required"));
        }

        @Test
        @DisplayName("Should answer 400 on a malformed body")
        void shouldRejectMalformedBody() throws Exception {
            mockMvc.perform(post("/api/v1/cron/jobs")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Malformed request body"));
        }

        @Test
        @DisplayName("Should list jobs with filters")
        void shouldListJobs() throws Exception {
            when(jobManagementService.listJobs(true, "acme")).thenReturn(List.of(job()));

            mockMvc.perform(get("/api/v1/cron/jobs").param("active", "true").param("tenantId", "acme"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data", hasSize(1)))
                    .andExpect(jsonPath("$.data[0].name").value("Nightly cleanup"));
        }

        @Test
        @DisplayName("Should answer 404 for an unknown job")
        void shouldReturnNotFound() throws Exception {
            when(jobManagementService.getJob(JOB_ID, false)).thenThrow(new JobNotFoundException(JOB_ID));

            mockMvc.perform(get("/api/v1/cron/jobs/{id}", JOB_ID))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Cron job not found: " + JOB_ID));
        }

        @Test
        @DisplayName("Should answer 400 for a malformed job id")
        void shouldRejectMalformedId() throws Exception {
            mockMvc.perform(get("/api/v1/cron/jobs/{id}", "not-a-uuid"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should pass includeHistory through")
        void shouldIncludeHistory() throws Exception {
            when(jobManagementService.getJob(JOB_ID, true)).thenReturn(job());

            mockMvc.perform(get("/api/v1/cron/jobs/{id}", JOB_ID).param("includeHistory", "true"))
                    .andExpect(status().isOk());

            verify(jobManagementService).getJob(JOB_ID, true);
        }

        @Test
        @DisplayName("Should update a job")
        void shouldUpdateJob() throws Exception {
            when(jobManagementService.updateJob(eq(JOB_ID), any(UpdateJobRequest.class))).thenReturn(job());

            mockMvc.perform(put("/api/v1/cron/jobs/{id}", JOB_ID)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"schedule\": \"daily\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Cron job updated successfully"));
        }

        @Test
        @DisplayName("Should answer 500 when the store fails")
        void shouldReturnServerErrorOnStoreFailure() throws Exception {
            doThrow(new JobStoreException("delete", new DataAccessResourceFailureException("connection refused")))
                    .when(jobManagementService).deleteJob(JOB_ID);

            mockMvc.perform(delete("/api/v1/cron/jobs/{id}", JOB_ID))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should delete a job")
        void shouldDeleteJob() throws Exception {
            mockMvc.perform(delete("/api/v1/cron/jobs/{id}", JOB_ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Cron job deleted successfully"));

            verify(jobManagementService).deleteJob(JOB_ID);
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should run due jobs and return the pass summary")
        void shouldRunDueJobs() throws Exception {
            when(cronRunService.runDueJobs()).thenReturn(PassSummary.builder()
                    .total(3)
                    .executed(2)
                    .failed(1)
                    .failedJobs(List.of(PassSummary.FailedJob.builder()
                            .id(JOB_ID)
                            .name("Nightly cleanup")
                            .error("boom")
                            .build()))
                    .build());

            mockMvc.perform(post("/api/v1/cron/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Executed 2 of 3 due jobs"))
                    .andExpect(jsonPath("$.data.failedJobs[0].error").value("boom"));
        }

        @Test
        @DisplayName("Should run one job now and report a failure in the body")
        void shouldRunJobNow() throws Exception {
            when(cronRunService.runJobNow(JOB_ID)).thenReturn(ForcedRunResult.builder()
                    .job(job())
                    .success(false)
                    .error("boom")
                    .build());

            mockMvc.perform(post("/api/v1/cron/jobs/{id}/run", JOB_ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.success").value(false))
                    .andExpect(jsonPath("$.message").value("Job \"Nightly cleanup\" failed: boom"));
        }

        @Test
        @DisplayName("Should still answer 200 when the job was deleted during its run")
        void shouldReportDeletedDuringRun() throws Exception {
            when(cronRunService.runJobNow(JOB_ID)).thenReturn(ForcedRunResult.builder()
                    .job(job())
                    .success(true)
                    .jobDeleted(true)
                    .build());

            mockMvc.perform(post("/api/v1/cron/jobs/{id}/run", JOB_ID))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.jobDeleted").value(true))
                    .andExpect(jsonPath("$.message")
                            .value("Job \"Nightly cleanup\" executed (job was deleted during the run)"));
        }

        @Test
        @DisplayName("Should answer 404 when running an unknown job")
        void shouldReturnNotFoundOnRun() throws Exception {
            when(cronRunService.runJobNow(JOB_ID)).thenThrow(new JobNotFoundException(JOB_ID));

            mockMvc.perform(post("/api/v1/cron/jobs/{id}/run", JOB_ID))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should list registered functions")
        void shouldListFunctions() throws Exception {
            when(functionRegistry.getRegisteredNames()).thenReturn(Set.of("cleanExecutionLogs"));

            mockMvc.perform(get("/api/v1/cron/functions"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0]").value("cleanExecutionLogs"));
        }
    }

    @Test
    @DisplayName("Should serialize metadata as a plain object")
    void shouldSerializeMetadata() throws Exception {
        var response = job();
        response.setMetadata(JobMetadata.of(Map.of("retentionDays", 30)));
        when(jobManagementService.getJob(JOB_ID, false)).thenReturn(response);

        mockMvc.perform(get("/api/v1/cron/jobs/{id}", JOB_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.metadata.retentionDays").value(30));
    }
}
