package com.example.cronscheduler.service.dispatch;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry with exponential backoff and additive jitter for outbound calls.
 * <p>
 * The n-th retry waits {@code base * 2^(n-1)} plus a random share of up to
 * {@code jitterFactor} of that delay. Only failures accepted by the
 * predicate are retried; anything else, and the last failure once retries
 * are exhausted, is rethrown to the caller.
 */
@Slf4j
public class RetryPolicy {

    private final Duration baseDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;
    private final Retry retry;

    public RetryPolicy(String name, int maxRetries, Duration baseDelay, double jitterFactor, Predicate<Throwable> retryable) {
        this(name, maxRetries, baseDelay, jitterFactor, retryable, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(String name, int maxRetries, Duration baseDelay, double jitterFactor,
                Predicate<Throwable> retryable, DoubleSupplier random) {
        this.baseDelay = baseDelay;
        this.jitterFactor = jitterFactor;
        this.random = random;

        var config = RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction((IntervalFunction) this::delayMillis)
                .retryOnException(retryable)
                .failAfterMaxAttempts(false)
                .build();

        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("[{}] Attempt {} failed, retrying in {}ms: {}",
                        name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
                .onError(event -> log.error("[{}] Giving up after {} attempt(s): {}",
                        name, event.getNumberOfRetryAttempts() + 1,
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Run the call, retrying transient failures
     */
    public <T> T execute(Supplier<T> call) {
        return retry.executeSupplier(call);
    }

    /**
     * Delay before the given retry, 1-based
     */
    long delayMillis(int retryNumber) {
        var delay = baseDelay.toMillis() * (1L << Math.max(0, retryNumber - 1));
        var jitter = (long) (random.getAsDouble() * jitterFactor * delay);
        return delay + jitter;
    }

    /**
     * Underlying Resilience4j retry, for event subscriptions and metrics
     */
    public Retry getRetry() {
        return retry;
    }
}
