package com.example.cronscheduler.service.job;

import java.util.Set;

/**
 * An executable unit a cron job can name in its {@code functionName}.
 * <p>
 * Implementations should:
 * - Be stateless, reading their configuration from the job metadata
 * - Report expected failures through {@link JobResult#failure(String)}
 * - Not manage the job's schedule or counters (handled by the run loop)
 */
public interface JobFunction {

    /**
     * Primary registry name
     */
    String getName();

    /**
     * Additional names this function answers to, e.g. snake_case legacy names
     */
    default Set<String> getAliases() {
        return Set.of();
    }

    /**
     * Execute the function
     *
     * @param context Job being executed, its metadata and the job store
     * @return Result of the execution
     */
    JobResult execute(JobContext context);
}
