package com.example.cronscheduler.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Cluster lock for the in-process poller, only wired when the poller is on.
 * <p>
 * One instance polls at a time. Each job is still claimed through a
 * version-conditional update, which covers passes triggered over HTTP.
 */
@Configuration
@ConditionalOnProperty(prefix = "cron-scheduler.poller", name = "enabled", havingValue = "true")
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

    @Bean
    public LockProvider cronPassLockProvider(DataSource dataSource,
                                             @Value("${HOSTNAME:cron-scheduler}") String lockedBy) {
        var config = JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(new JdbcTemplate(dataSource))
                .withTableName("shedlock")
                .withLockedByValue(lockedBy)
                .usingDbTime()
                .build();
        return new JdbcTemplateLockProvider(config);
    }
}
