package com.foreman.core.error;

/**
 * Thrown when verification commands keep failing after all agent fix-up attempts.
 */
public class VerificationFailedException extends RuntimeException {

    public VerificationFailedException(String message) {
        super(message);
    }
}
