package com.example.cronscheduler.domain.entity;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execution bookkeeping and job-specific configuration for a cron job.
 * <p>
 * Known counters are typed; anything else a job function reads from its
 * metadata (retention days, thresholds, ...) lives in the extension map and
 * is serialized flat next to the known fields. Updates are additive: a merge
 * overwrites only the keys it carries.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobMetadata {

    public static final String EXECUTION_COUNT = "execution_count";
    public static final String ERROR_COUNT = "error_count";
    public static final String LAST_ERROR = "last_error";
    public static final String LAST_ERROR_AT = "last_error_at";
    public static final String LAST_EXECUTION = "last_execution";

    @JsonProperty(EXECUTION_COUNT)
    private int executionCount;

    @JsonProperty(ERROR_COUNT)
    private int errorCount;

    @JsonProperty(LAST_ERROR)
    private String lastError;

    @JsonProperty(LAST_ERROR_AT)
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant lastErrorAt;

    @JsonProperty(LAST_EXECUTION)
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant lastExecution;

    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    public static JobMetadata of(Map<String, Object> values) {
        var metadata = new JobMetadata();
        if (values != null) {
            metadata.merge(values);
        }
        return metadata;
    }

    public JobMetadata copy() {
        var copy = new JobMetadata();
        copy.executionCount = executionCount;
        copy.errorCount = errorCount;
        copy.lastError = lastError;
        copy.lastErrorAt = lastErrorAt;
        copy.lastExecution = lastExecution;
        copy.extra = new LinkedHashMap<>(extra);
        return copy;
    }

    /**
     * Merge entries into this metadata, leaving keys not present in {@code values} untouched.
     */
    public JobMetadata merge(Map<String, Object> values) {
        values.forEach(this::put);
        return this;
    }

    @JsonAnySetter
    public void put(String key, Object value) {
        switch (key) {
            case EXECUTION_COUNT -> executionCount = toInt(value);
            case ERROR_COUNT -> errorCount = toInt(value);
            case LAST_ERROR -> lastError = value != null ? value.toString() : null;
            case LAST_ERROR_AT -> lastErrorAt = toInstant(value);
            case LAST_EXECUTION -> lastExecution = toInstant(value);
            default -> extra.put(key, value);
        }
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    /**
     * Get a job-specific configuration value, or the fallback when absent
     */
    public int getInt(String key, int fallback) {
        var value = extra.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return toInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static int toInt(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    private static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        return Instant.parse(value.toString());
    }
}
