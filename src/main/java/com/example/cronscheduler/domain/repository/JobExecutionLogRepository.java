package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.JobExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobExecutionLog entity
 */
@Repository
public interface JobExecutionLogRepository extends JpaRepository<JobExecutionLog, UUID> {

    /**
     * Latest executions for a job, newest first
     */
    List<JobExecutionLog> findTop20ByJobIdOrderByStartedAtDesc(UUID jobId);

    /**
     * Delete execution history older than the cutoff
     */
    @Modifying
    @Query("""
            DELETE FROM JobExecutionLog el
            WHERE el.startedAt < :cutoff
            """)
    int deleteOlderThan(@Param("cutoff") Instant cutoff);

    /**
     * Delete all history of a job
     */
    @Modifying
    @Query("DELETE FROM JobExecutionLog el WHERE el.jobId = :jobId")
    int deleteByJobIdBulk(@Param("jobId") UUID jobId);
}
