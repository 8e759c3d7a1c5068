package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for outbound calls to external services (issue tracker, ...).
 * <p>
 * Rate limiting (429), server errors and transport failures are transient;
 * any other HTTP error is permanent and must not be retried.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    /**
     * Service cannot be called at all (not configured, circuit open)
     */
    public static ExternalServiceException unavailable(String serviceName, String message) {
        return new ExternalServiceException(serviceName, message, null, false);
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        super(String.format("[%s] %s", serviceName, cause.getMessage()), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.retryable = isTransientStatus(httpStatusCode);
    }

    private ExternalServiceException(String serviceName, String message, Exception cause, boolean retryable) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = retryable;
    }

    public static boolean isTransientStatus(int httpStatusCode) {
        return httpStatusCode >= 500 || httpStatusCode == 429;
    }
}
