package com.example.cronscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * A recurring unit of work.
 * <p>
 * The run loop selects active jobs whose next run is unset or in the past,
 * advances the schedule and invokes the job function registered under
 * {@code functionName}.
 */
@Entity
@Table(name = "cron_job", indexes = {
        @Index(name = "idx_cron_job_active_next_run", columnList = "is_active, next_run"),
        @Index(name = "idx_cron_job_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CronJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Owning tenant, null for system-wide jobs
     */
    @Column(name = "tenant_id", length = 100)
    private String tenantId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Schedule alias or cron-style expression
     */
    @Column(name = "schedule", nullable = false, length = 100)
    private String schedule;

    /**
     * Registry key of the job function to execute
     */
    @Column(name = "function_name", nullable = false, length = 100)
    private String functionName;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /**
     * Null means due immediately
     */
    @Column(name = "next_run")
    private Instant nextRun;

    @Column(name = "last_run")
    private Instant lastRun;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    @Builder.Default
    private JobMetadata metadata = new JobMetadata();

    /**
     * Version for optimistic locking, also used as the claim token by the run loop
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.metadata == null) {
            this.metadata = new JobMetadata();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Check if the job is due at the given instant
     */
    public boolean isDue(Instant now) {
        return active && (nextRun == null || !nextRun.isAfter(now));
    }
}
