package com.example.cronscheduler.service.store;

import com.example.cronscheduler.domain.entity.CronJob;
import com.example.cronscheduler.domain.entity.JobMetadata;
import com.example.cronscheduler.domain.repository.CronJobRepository;
import com.example.cronscheduler.domain.repository.JobExecutionLogRepository;
import com.example.cronscheduler.exception.JobClaimConflictException;
import com.example.cronscheduler.exception.JobStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link JobStore} backed by PostgreSQL through Spring Data JPA.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final CronJobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;

    @Override
    @Transactional(readOnly = true)
    public List<CronJob> listDue(Instant now) {
        return translate("listDue", () -> jobRepository.findDueJobs(now));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CronJob> list(JobFilter filter) {
        var effective = filter != null ? filter : JobFilter.all();
        return translate("list", () -> jobRepository.findByFilter(effective.getActive(), effective.getTenantId()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CronJob> get(UUID id) {
        return translate("get", () -> jobRepository.findById(id));
    }

    @Override
    @Transactional
    public CronJob create(NewJob job) {
        var entity = CronJob.builder()
                .tenantId(job.getTenantId())
                .name(job.getName())
                .schedule(job.getSchedule())
                .functionName(job.getFunctionName())
                .active(job.isActive())
                .nextRun(job.getNextRun())
                .metadata(JobMetadata.of(job.getMetadata()))
                .build();

        return translate("create", () -> jobRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public Optional<CronJob> update(UUID id, JobPatch patch) {
        return translate("update", () -> {
            var existing = jobRepository.findById(id);
            if (existing.isEmpty()) {
                return Optional.<CronJob>empty();
            }

            var job = existing.get();
            if (patch.getExpectedVersion() != null && !Objects.equals(job.getVersion(), patch.getExpectedVersion())) {
                throw new JobClaimConflictException(id, patch.getExpectedVersion());
            }

            applyPatch(job, patch);

            try {
                return Optional.of(jobRepository.saveAndFlush(job));
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Job {} changed while being updated: {}", id, e.getMessage());
                throw new JobClaimConflictException(id, patch.getExpectedVersion());
            }
        });
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        return translate("delete", () -> {
            if (!jobRepository.existsById(id)) {
                return false;
            }
            executionLogRepository.deleteByJobIdBulk(id);
            jobRepository.deleteById(id);
            return true;
        });
    }

    private void applyPatch(CronJob job, JobPatch patch) {
        if (patch.getName() != null) {
            job.setName(patch.getName());
        }
        if (patch.getSchedule() != null) {
            job.setSchedule(patch.getSchedule());
        }
        if (patch.getFunctionName() != null) {
            job.setFunctionName(patch.getFunctionName());
        }
        if (patch.getActive() != null) {
            job.setActive(patch.getActive());
        }
        if (patch.getNextRun() != null) {
            job.setNextRun(patch.getNextRun());
        }
        if (patch.getLastRun() != null) {
            job.setLastRun(patch.getLastRun());
        }
        if (!patch.getMetadata().isEmpty()) {
            // new instance so the JSON column is seen as dirty
            var current = job.getMetadata() != null ? job.getMetadata() : new JobMetadata();
            job.setMetadata(current.copy().merge(patch.getMetadata()));
        }
    }

    private <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Job store {} failed: {}", operation, e.getMessage());
            throw new JobStoreException(operation, e);
        }
    }
}
