package com.foreman.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of an execution failure. The wire value is used in events and logs.
 */
public enum ErrorType {
    AUTHENTICATION("authentication"),
    MODEL_NOT_FOUND("model_not_found"),
    STREAM_DISCONNECTED("stream_disconnected"),
    QUOTA_EXHAUSTED("quota_exhausted"),
    RATE_LIMIT("rate_limit"),
    ABORT("abort"),
    CANCELLATION("cancellation"),
    AGENT_ERROR("agent_error"),
    VERIFICATION_FAILED("verification_failed"),
    UNKNOWN("unknown");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
