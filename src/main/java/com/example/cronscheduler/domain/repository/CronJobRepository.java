package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.CronJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for CronJob entity.
 */
@Repository
public interface CronJobRepository extends JpaRepository<CronJob, UUID> {

    /**
     * Find active jobs that are due.
     * <p>
     * Jobs without a computed next run come first, then by next run ascending.
     */
    @Query("""
            SELECT j FROM CronJob j
            WHERE j.active = true
              AND (j.nextRun IS NULL OR j.nextRun <= :now)
            ORDER BY j.nextRun ASC NULLS FIRST
            """)
    List<CronJob> findDueJobs(@Param("now") Instant now);

    /**
     * List jobs with optional active flag and tenant filters
     */
    @Query("""
            SELECT j FROM CronJob j
            WHERE (:active IS NULL OR j.active = :active)
              AND (:tenantId IS NULL OR j.tenantId = :tenantId)
            ORDER BY j.createdAt DESC
            """)
    List<CronJob> findByFilter(@Param("active") Boolean active, @Param("tenantId") String tenantId);

    long countByActiveTrue();

    @Query("""
            SELECT COUNT(j) FROM CronJob j
            WHERE j.active = true
              AND (j.nextRun IS NULL OR j.nextRun <= :now)
            """)
    long countDueJobs(@Param("now") Instant now);
}
