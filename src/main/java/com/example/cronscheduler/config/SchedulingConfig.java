package com.example.cronscheduler.config;

import com.example.cronscheduler.domain.schedule.ScheduleEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time source and schedule evaluation beans.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScheduleEvaluator scheduleEvaluator(CronSchedulerProperties properties) {
        var zone = ZoneId.of(properties.getZone());
        log.info("Evaluating schedules in zone {}", zone);
        return new ScheduleEvaluator(zone);
    }
}
