package com.example.cronscheduler.domain.schedule;

import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed vocabulary of schedule expressions understood by the evaluator.
 * Each entry accepts one or more human aliases and a 5-field cron-style equivalent.
 */
@Getter
public enum ScheduleAlias {

    EVERY_MINUTE(List.of("every_minute"), "* * * * *"),

    EVERY_5_MINUTES(List.of("every_5_minutes"), "*/5 * * * *"),

    EVERY_15_MINUTES(List.of("every_15_minutes"), "*/15 * * * *"),

    EVERY_30_MINUTES(List.of("every_30_minutes"), "*/30 * * * *"),

    HOURLY(List.of("hourly", "every_hour"), "0 * * * *"),

    DAILY(List.of("daily"), "0 0 * * *"),

    /**
     * Week starts on day-of-week 0 (Sunday)
     */
    WEEKLY(List.of("weekly"), "0 0 * * 0");

    private final List<String> aliases;
    private final String cronExpression;

    ScheduleAlias(List<String> aliases, String cronExpression) {
        this.aliases = aliases;
        this.cronExpression = cronExpression;
    }

    /**
     * Resolve a schedule string, ignoring case, surrounding whitespace and
     * hyphen/underscore differences in the human aliases.
     */
    public static Optional<ScheduleAlias> resolve(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            return Optional.empty();
        }

        var normalized = schedule.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        var aliasForm = normalized.replace('-', '_');

        for (var alias : values()) {
            if (alias.cronExpression.equals(normalized) || alias.aliases.contains(aliasForm)) {
                return Optional.of(alias);
            }
        }
        return Optional.empty();
    }

    /**
     * Check if the given schedule string is part of the known vocabulary
     */
    public static boolean isKnown(String schedule) {
        return resolve(schedule).isPresent();
    }
}
