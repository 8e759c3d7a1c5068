package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for job persistence failures
 */
@Getter
public class JobStoreException extends RuntimeException {

    private final String operation;

    public JobStoreException(String operation, Exception cause) {
        super(String.format("Job store %s failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
