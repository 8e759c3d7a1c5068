package com.example.cronscheduler.client;

import com.example.cronscheduler.exception.ExternalServiceException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.util.function.Predicate;

/**
 * Failures that say something about the tracker's health: rate limits,
 * server errors and transport errors.
 * <p>
 * Used as the {@code github} circuit breaker's record predicate and by the
 * issue retry policy. A rejected payload or a bad token is the caller's
 * problem and leaves the breaker alone.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalServiceException external) {
            return external.isRetryable();
        }
        return throwable instanceof WebClientRequestException;
    }
}
