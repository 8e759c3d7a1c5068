package com.example.cronscheduler.service.job;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.dto.DispatchResult;
import com.example.cronscheduler.exception.ExternalServiceException;
import com.example.cronscheduler.service.dispatch.IdempotentIssueDispatcher;
import com.example.cronscheduler.service.dispatch.Incident;
import com.example.cronscheduler.service.store.JobFilter;
import com.example.cronscheduler.service.store.JobStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportFailingJobsJob Tests")
class ReportFailingJobsJobTest {

    @Mock
    private IdempotentIssueDispatcher dispatcher;

    @Mock
    private JobStore jobStore;

    @InjectMocks
    private ReportFailingJobsJob job;

    @Captor
    private ArgumentCaptor<Incident> incidentCaptor;

    private final UUID selfId = UUID.randomUUID();

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("Should report only active jobs at or above the threshold, never itself")
        void shouldReportFailingJobs() {
            // Given
            var failing = cronJob("sync", 3, "timeout after 30000ms");
            var healthy = cronJob("digest", 1, null);
            var self = cronJob("reporter", 9, "x");
            self.setId(selfId);
            when(jobStore.list(any(JobFilter.class))).thenReturn(List.of(failing, healthy, self));
            when(dispatcher.dispatch(any())).thenReturn(DispatchResult.builder().number(7).build());

            // When
            var result = job.execute(context(new JobMetadata()));

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getData()).containsEntry("failing", 1).containsEntry("created", 1);
            verify(dispatcher).dispatch(incidentCaptor.capture());

            var incident = incidentCaptor.getValue();
            assertThat(incident.getType()).isEqualTo("system");
            assertThat(incident.getComponent()).isEqualTo("cron");
            assertThat(incident.getSeverity()).isEqualTo("high");
            assertThat(incident.getTitle()).isEqualTo("Cron job failing: sync");
            assertThat(incident.getDescription()).contains("failed 3 times").contains("timeout after 30000ms");
            assertThat(incident.getContext()).containsEntry("function_name", "syncCounts");
        }

        @Test
        @DisplayName("Should honour error_threshold from metadata")
        void shouldUseMetadataThreshold() {
            when(jobStore.list(any(JobFilter.class))).thenReturn(List.of(cronJob("sync", 3, "boom")));

            var result = job.execute(context(JobMetadata.of(Map.of("error_threshold", 5))));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getData()).containsEntry("failing", 0);
            verify(dispatcher, never()).dispatch(any());
        }
    }

    @Nested
    @DisplayName("Dispatch Outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("Should count suppressed duplicates separately")
        void shouldCountSuppressed() {
            when(jobStore.list(any(JobFilter.class))).thenReturn(List.of(cronJob("a", 4, "e"), cronJob("b", 4, "e")));
            when(dispatcher.dispatch(any()))
                    .thenReturn(DispatchResult.builder().suppressed(true).number(1).build())
                    .thenReturn(DispatchResult.builder().number(2).build());

            var result = job.execute(context(new JobMetadata()));

            assertThat(result.getData()).containsEntry("created", 1).containsEntry("suppressed", 1);
        }

        @Test
        @DisplayName("Should keep going after a dispatch error and report failure")
        void shouldFailWhenDispatchFails() {
            when(jobStore.list(any(JobFilter.class))).thenReturn(List.of(cronJob("a", 4, "e"), cronJob("b", 4, "e")));
            when(dispatcher.dispatch(any()))
                    .thenThrow(new ExternalServiceException("GitHub", 401, "Bad credentials"))
                    .thenReturn(DispatchResult.builder().number(2).build());

            var result = job.execute(context(new JobMetadata()));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorType()).isEqualTo("DISPATCH_FAILED");
            assertThat(result.getErrorMessage()).contains("a:");
            assertThat(result.getData()).containsEntry("created", 1);
            verify(dispatcher, times(2)).dispatch(any());
        }
    }

    private JobContext context(JobMetadata metadata) {
        return JobContext.builder()
                .jobId(selfId)
                .jobName("reporter")
                .functionName("reportFailingJobs")
                .metadata(metadata)
                .jobStore(jobStore)
                .now(Instant.parse("2024-06-12T10:00:00Z"))
                .build();
    }

    private static CronJob cronJob(String name, int errorCount, String lastError) {
        var metadata = new JobMetadata();
        metadata.setErrorCount(errorCount);
        metadata.setExecutionCount(errorCount + 2);
        metadata.setLastError(lastError);
        return CronJob.builder()
                .id(UUID.randomUUID())
                .name(name)
                .schedule("hourly")
                .functionName("syncCounts")
                .metadata(metadata)
                .build();
    }
}
