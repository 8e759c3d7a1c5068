package com.example.cronscheduler.service.job;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.domain.repository.JobExecutionLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CleanExecutionLogsJob Tests")
class CleanExecutionLogsJobTest {

    private static final Instant NOW = Instant.parse("2024-06-12T10:00:00Z");

    @Mock
    private JobExecutionLogRepository executionLogRepository;

    private CleanExecutionLogsJob job;

    @BeforeEach
    void setUp() {
        var properties = new CronSchedulerProperties();
        properties.setExecutionLogRetentionDays(30);
        job = new CleanExecutionLogsJob(executionLogRepository, properties);
    }

    @Test
    @DisplayName("Should answer to camelCase and snake_case names")
    void shouldExposeNames() {
        assertThat(job.getName()).isEqualTo("cleanExecutionLogs");
        assertThat(job.getAliases()).containsExactly("clean_execution_logs");
    }

    @Test
    @DisplayName("Should use configured retention when metadata has none")
    void shouldUseDefaultRetention() {
        // Given
        when(executionLogRepository.deleteOlderThan(Instant.parse("2024-05-13T10:00:00Z"))).thenReturn(12);

        // When
        var result = job.execute(context(new JobMetadata()));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).containsEntry("deleted", 12).containsEntry("retention_days", 30);
    }

    @Test
    @DisplayName("Should use retention_days from metadata")
    void shouldUseMetadataRetention() {
        when(executionLogRepository.deleteOlderThan(Instant.parse("2024-06-05T10:00:00Z"))).thenReturn(0);

        var result = job.execute(context(JobMetadata.of(Map.of("retention_days", 7))));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).containsEntry("retention_days", 7);
    }

    @Test
    @DisplayName("Should reject a retention below one day")
    void shouldRejectInvalidRetention() {
        var result = job.execute(context(JobMetadata.of(Map.of("retention_days", 0))));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo("INVALID_METADATA");
        verify(executionLogRepository, never()).deleteOlderThan(any());
    }

    private static JobContext context(JobMetadata metadata) {
        return JobContext.builder()
                .jobId(UUID.randomUUID())
                .jobName("nightly cleanup")
                .functionName("cleanExecutionLogs")
                .metadata(metadata)
                .now(NOW)
                .build();
    }
}
