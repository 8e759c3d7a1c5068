package com.example.cronscheduler.exception;

/**
 * Exception for a job definition or update that cannot be accepted as given
 */
public class InvalidJobException extends RuntimeException {

    public InvalidJobException(String message) {
        super(message);
    }
}
