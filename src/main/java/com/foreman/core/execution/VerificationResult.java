package com.foreman.core.execution;

/**
 * @param passed        true when every command exited with 0
 * @param failedCommand first failing command, null when passed
 * @param output        combined output of the commands that ran
 */
public record VerificationResult(boolean passed, String failedCommand, String output) {

    public static VerificationResult success(String output) {
        return new VerificationResult(true, null, output);
    }
}
