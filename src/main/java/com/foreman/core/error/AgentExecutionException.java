package com.foreman.core.error;

/**
 * Thrown when the agent process exits abnormally.
 * Carries the exit code and the tail of the agent output for diagnostics.
 */
public class AgentExecutionException extends RuntimeException {

    private final int exitCode;
    private final String outputTail;

    public AgentExecutionException(String message, int exitCode, String outputTail) {
        super(message);
        this.exitCode = exitCode;
        this.outputTail = outputTail;
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.outputTail = "";
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutputTail() {
        return outputTail;
    }
}
