package com.example.cronscheduler.service.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Triggers a run-loop pass on a fixed delay.
 * <p>
 * Disabled by default, passes are normally triggered over HTTP. When enabled,
 * ShedLock keeps a single instance polling at a time across the cluster.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cron-scheduler.poller", name = "enabled", havingValue = "true")
public class CronPoller {

    private final CronRunService cronRunService;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${cron-scheduler.poller.interval-ms:60000}")
    @SchedulerLock(name = "cronRunPass", lockAtLeastFor = "10s", lockAtMostFor = "10m")
    public void poll() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous cron pass still running, skipping");
            return;
        }

        try {
            cronRunService.runDueJobs();
        } catch (Exception e) {
            log.error("Error in cron pass: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }
}
