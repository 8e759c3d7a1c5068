package com.example.cronscheduler.service.store;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.domain.repository.JobExecutionLogRepository;
import com.example.cronscheduler.exception.JobClaimConflictException;
import com.example.cronscheduler.exception.JobStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaJobStore Tests")
class JpaJobStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-12T10:00:00Z");

    @Mock
    private CronJobRepository jobRepository;

    @Mock
    private JobExecutionLogRepository executionLogRepository;

    @InjectMocks
    private JpaJobStore jobStore;

    @Captor
    private ArgumentCaptor<CronJob> jobCaptor;

    private CronJob storedJob(long version) {
        return CronJob.builder()
                .id(UUID.randomUUID())
                .name("sync")
                .schedule("hourly")
                .functionName("syncCounts")
                .metadata(JobMetadata.of(Map.of("execution_count", 2, "retention_days", 7)))
                .version(version)
                .build();
    }

    @Nested
    @DisplayName("Update Tests")
    class UpdateTests {

        @Test
        @DisplayName("Should apply set fields and merge metadata into a new instance")
        void shouldApplyPatch() {
            // Given
            var job = storedJob(4);
            var originalMetadata = job.getMetadata();
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
            when(jobRepository.saveAndFlush(any(CronJob.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            var updated = jobStore.update(job.getId(), JobPatch.builder()
                    .nextRun(NOW.plusSeconds(3600))
                    .lastRun(NOW)
                    .metadataEntry(JobMetadata.EXECUTION_COUNT, 3)
                    .expectedVersion(4L)
                    .build());

            // Then
            assertThat(updated).isPresent();
            verify(jobRepository).saveAndFlush(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getName()).isEqualTo("sync");
            assertThat(saved.getNextRun()).isEqualTo(NOW.plusSeconds(3600));
            assertThat(saved.getLastRun()).isEqualTo(NOW);
            assertThat(saved.getMetadata()).isNotSameAs(originalMetadata);
            assertThat(saved.getMetadata().getExecutionCount()).isEqualTo(3);
            assertThat(saved.getMetadata().getExtra()).containsEntry("retention_days", 7);
        }

        @Test
        @DisplayName("Should reject a claim when the version has moved on")
        void shouldRejectStaleVersion() {
            var job = storedJob(5);
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

            assertThatThrownBy(() -> jobStore.update(job.getId(), JobPatch.builder().lastRun(NOW).expectedVersion(4L).build()))
                    .isInstanceOf(JobClaimConflictException.class);
            verify(jobRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should turn an optimistic lock failure into a claim conflict")
        void shouldTranslateOptimisticLockFailure() {
            var job = storedJob(4);
            when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
            when(jobRepository.saveAndFlush(any(CronJob.class)))
                    .thenThrow(new ObjectOptimisticLockingFailureException(CronJob.class, job.getId()));

            assertThatThrownBy(() -> jobStore.update(job.getId(), JobPatch.builder().lastRun(NOW).expectedVersion(4L).build()))
                    .isInstanceOf(JobClaimConflictException.class);
        }

        @Test
        @DisplayName("Should return empty for a missing job")
        void shouldReturnEmptyWhenMissing() {
            var id = UUID.randomUUID();
            when(jobRepository.findById(id)).thenReturn(Optional.empty());

            assertThat(jobStore.update(id, JobPatch.builder().name("x").build())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Query and Delete Tests")
    class QueryTests {

        @Test
        @DisplayName("Should wrap data access failures")
        void shouldWrapDataAccessFailure() {
            when(jobRepository.findDueJobs(NOW)).thenThrow(new DataAccessResourceFailureException("connection refused"));

            assertThatThrownBy(() -> jobStore.listDue(NOW))
                    .isInstanceOf(JobStoreException.class)
                    .hasMessageContaining("listDue")
                    .hasMessageContaining("connection refused");
        }

        @Test
        @DisplayName("Should pass filters through to the repository")
        void shouldListWithFilter() {
            when(jobRepository.findByFilter(true, "t1")).thenReturn(List.of(storedJob(0)));

            assertThat(jobStore.list(JobFilter.builder().active(true).tenantId("t1").build())).hasSize(1);
        }

        @Test
        @DisplayName("Should list everything for a null filter")
        void shouldListAllForNullFilter() {
            when(jobRepository.findByFilter(null, null)).thenReturn(List.of());

            assertThat(jobStore.list(null)).isEmpty();
        }

        @Test
        @DisplayName("Should delete history along with the job")
        void shouldDeleteWithHistory() {
            var id = UUID.randomUUID();
            when(jobRepository.existsById(id)).thenReturn(true);

            assertThat(jobStore.delete(id)).isTrue();
            verify(executionLogRepository).deleteByJobIdBulk(id);
            verify(jobRepository).deleteById(id);
        }

        @Test
        @DisplayName("Should report false when deleting a missing job")
        void shouldNotDeleteMissing() {
            var id = UUID.randomUUID();
            when(jobRepository.existsById(id)).thenReturn(false);

            assertThat(jobStore.delete(id)).isFalse();
            verify(jobRepository, never()).deleteById(any());
        }

        @Test
        @DisplayName("Should create an active job with seeded metadata")
        void shouldCreateJob() {
            when(jobRepository.saveAndFlush(any(CronJob.class))).thenAnswer(inv -> inv.getArgument(0));

            var created = jobStore.create(NewJob.builder()
                    .name("digest")
                    .schedule("daily")
                    .functionName("sendDigest")
                    .nextRun(NOW)
                    .metadata(Map.of("recipients", 3))
                    .build());

            assertThat(created.isActive()).isTrue();
            assertThat(created.getMetadata().getExtra()).containsEntry("recipients", 3);
        }
    }
}
