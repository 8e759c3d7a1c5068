package com.example.cronscheduler.domain.schedule;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Computes the next run instant for a schedule expression.
 * <p>
 * Deterministic for a given (schedule, from) pair. Calendar boundaries
 * (hour, day, week) are evaluated in the configured zone.
 */
@Slf4j
public class ScheduleEvaluator {

    static final Duration UNKNOWN_SCHEDULE_FALLBACK = Duration.ofMinutes(5);

    private final ZoneId zone;

    public ScheduleEvaluator() {
        this(ZoneOffset.UTC);
    }

    public ScheduleEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Compute the next run time.
     *
     * @param schedule Schedule expression, alias or cron-style
     * @param from     Reference instant
     * @return Next run instant, strictly after {@code from}, or null when no schedule is set
     */
    public Instant nextRun(String schedule, Instant from) {
        if (schedule == null || schedule.isBlank()) {
            return null;
        }

        var alias = ScheduleAlias.resolve(schedule);
        if (alias.isEmpty()) {
            log.warn("Unknown schedule '{}', defaulting to {} minutes", schedule, UNKNOWN_SCHEDULE_FALLBACK.toMinutes());
            return from.plus(UNKNOWN_SCHEDULE_FALLBACK);
        }

        var local = from.atZone(zone);

        return switch (alias.get()) {
            case EVERY_MINUTE -> from.plus(Duration.ofMinutes(1));
            case EVERY_5_MINUTES -> from.plus(Duration.ofMinutes(5));
            case EVERY_15_MINUTES -> from.plus(Duration.ofMinutes(15));
            case EVERY_30_MINUTES -> from.plus(Duration.ofMinutes(30));
            case HOURLY -> local.truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
            case DAILY -> local.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
            case WEEKLY -> {
                // Sunday = 0; landing on Sunday already still moves a full week
                var dayOfWeek = local.getDayOfWeek().getValue() % 7;
                var daysToAdd = dayOfWeek == 0 ? 7 : 7 - dayOfWeek;
                yield local.toLocalDate().plusDays(daysToAdd).atStartOfDay(zone).toInstant();
            }
        };
    }

    public ZoneId getZone() {
        return zone;
    }
}
