package com.example.cronscheduler.exception;

/**
 * Exception for idempotency store lookups or writes that could not be completed
 */
public class IdempotencyStoreException extends RuntimeException {

    public IdempotencyStoreException(String message) {
        super(message);
    }

    public IdempotencyStoreException(String message, Exception cause) {
        super(message, cause);
    }
}
