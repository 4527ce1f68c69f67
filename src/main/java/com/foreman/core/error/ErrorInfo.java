package com.foreman.core.error;

/**
 * A classified failure.
 *
 * @param type       classification
 * @param message    original message
 * @param retryAfter seconds to wait before retrying, only set for rate limits
 */
public record ErrorInfo(
    ErrorType type,
    String message,
    Integer retryAfter
) {

    public static ErrorInfo of(ErrorType type, String message) {
        return new ErrorInfo(type, message, null);
    }

    public boolean isAbort() {
        return type == ErrorType.ABORT || type == ErrorType.CANCELLATION;
    }

    public boolean isQuotaOrRateLimit() {
        return type == ErrorType.QUOTA_EXHAUSTED || type == ErrorType.RATE_LIMIT;
    }

    /** Whether the failure counts toward the consecutive-failure circuit breaker. */
    public boolean countsTowardBreaker() {
        return !isAbort();
    }
}
