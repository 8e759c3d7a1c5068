package com.example.cronscheduler.service.job;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of a job function invocation.
 * <p>
 * A result with {@code success = false} is recorded on the job exactly like
 * a thrown exception.
 */
@Data
@Builder
public class JobResult {

    private boolean success;

    private String errorMessage;

    /**
     * Error classification for metrics and history
     */
    private String errorType;

    /**
     * Stack trace if the failure came from an exception
     */
    private String stackTrace;

    /**
     * Data the function reports back (counts, ids, ...)
     */
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    public static JobResult success() {
        return JobResult.builder().success(true).build();
    }

    public static JobResult success(Map<String, Object> data) {
        return JobResult.builder()
                .success(true)
                .data(data != null ? new HashMap<>(data) : new HashMap<>())
                .build();
    }

    public static JobResult failure(String errorMessage) {
        return JobResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static JobResult failure(String errorMessage, String errorType) {
        return JobResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from an exception thrown by a job function
     */
    public static JobResult failure(Exception e) {
        return JobResult.builder()
                .success(false)
                .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .build();
    }

    /**
     * Truncate stack trace to keep history rows small
     */
    private static String truncateStackTrace(Exception e) {
        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }

    public JobResult withData(String key, Object value) {
        if (this.data == null) {
            this.data = new HashMap<>();
        }
        this.data.put(key, value);
        return this;
    }
}
