package com.example.cronscheduler.config;

import com.example.cronscheduler.client.TransientFailurePredicate;
import com.example.cronscheduler.service.dispatch.CaffeineIdempotencyStore;
import com.example.cronscheduler.service.dispatch.DisabledIdempotencyStore;
import com.example.cronscheduler.service.dispatch.IdempotencyStore;
import com.example.cronscheduler.service.dispatch.IncidentFingerprinter;
import com.example.cronscheduler.service.dispatch.IssueContentBuilder;
import com.example.cronscheduler.service.dispatch.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the idempotent incident dispatcher.
 */
@Slf4j
@Configuration
public class DispatchConfig {

    private static final TransientFailurePredicate TRANSIENT = new TransientFailurePredicate();

    @Bean
    public IdempotencyStore idempotencyStore(DispatchProperties properties) {
        if (!properties.isIdempotencyEnabled()) {
            log.warn("Incident deduplication disabled, every dispatch creates an issue");
            return new DisabledIdempotencyStore();
        }
        log.info("Incident deduplication window: {}", properties.getRetention());
        return new CaffeineIdempotencyStore();
    }

    @Bean
    public IncidentFingerprinter incidentFingerprinter(DispatchProperties properties) {
        return new IncidentFingerprinter(properties.getKeyPrefix());
    }

    @Bean
    public IssueContentBuilder issueContentBuilder(DispatchProperties properties, Clock clock, ObjectMapper objectMapper) {
        return new IssueContentBuilder(properties.getEnvironment(), properties.getBuildVersion(), clock, objectMapper);
    }

    /**
     * Retry policy for issue creation: rate limits, 5xx and transport errors only
     */
    @Bean
    public RetryPolicy issueRetryPolicy(DispatchProperties properties) {
        return new RetryPolicy("github-issues",
                properties.getMaxRetries(),
                properties.getInitialDelay(),
                properties.getJitterFactor(),
                DispatchConfig::isTransient);
    }

    static boolean isTransient(Throwable throwable) {
        return TRANSIENT.test(throwable);
    }
}
