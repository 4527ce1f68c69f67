package com.foreman.core.error;

/**
 * Thrown when an auto loop is started for a partition that already has one.
 */
public class AutoLoopAlreadyRunningException extends RuntimeException {

    public AutoLoopAlreadyRunningException(String message) {
        super(message);
    }
}
