package com.example.cronscheduler.service.store;

import com.example.cronscheduler.domain.entity.CronJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract consumed by the run loop, the admin service and job functions.
 * <p>
 * Implementations wrap persistence failures in
 * {@link com.example.cronscheduler.exception.JobStoreException}.
 */
public interface JobStore {

    /**
     * Active jobs whose next run is unset or not after {@code now},
     * unset first, then by next run ascending
     */
    List<CronJob> listDue(Instant now);

    List<CronJob> list(JobFilter filter);

    Optional<CronJob> get(UUID id);

    CronJob create(NewJob job);

    /**
     * Apply a patch. Metadata entries are merged, never replacing the whole map.
     *
     * @return the updated job, empty if it does not exist
     * @throws com.example.cronscheduler.exception.JobClaimConflictException if the patch
     *         carries an expected version that no longer matches
     */
    Optional<CronJob> update(UUID id, JobPatch patch);

    boolean delete(UUID id);
}
