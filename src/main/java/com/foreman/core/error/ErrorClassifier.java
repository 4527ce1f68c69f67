package com.foreman.core.error;

import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps exceptions to {@link ErrorInfo} by inspecting their type and message.
 * <p>
 * Precedence: authentication, model not found, stream disconnected, quota exhausted,
 * rate limit, abort, cancellation, then agent error for any other exception.
 */
public final class ErrorClassifier {

    static final int DEFAULT_RETRY_AFTER_SECONDS = 60;

    private static final Pattern RETRY_AFTER = Pattern.compile("retry[_-]?after[:\\s]+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WAIT_SECONDS = Pattern.compile("wait[:\\s]+(\\d+)\\s*(?:second|sec|s)", Pattern.CASE_INSENSITIVE);

    private ErrorClassifier() {}

    public static ErrorInfo classify(Throwable error) {
        if (error == null) {
            return ErrorInfo.of(ErrorType.UNKNOWN, "Unknown error");
        }
        Throwable cause = unwrap(error);
        if (cause instanceof VerificationFailedException) {
            return ErrorInfo.of(ErrorType.VERIFICATION_FAILED, messageOf(cause));
        }
        String message = messageOf(cause);
        boolean abort = cause instanceof InterruptedException
                || cause instanceof CancellationException
                || message.contains("abort");
        return classify(message, abort);
    }

    public static ErrorInfo classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorInfo.of(ErrorType.UNKNOWN, "Unknown error");
        }
        return classify(message, message.contains("abort"));
    }

    private static ErrorInfo classify(String message, boolean abort) {
        if (isAuthentication(message)) {
            return ErrorInfo.of(ErrorType.AUTHENTICATION, message);
        }
        if (isModelNotFound(message)) {
            return ErrorInfo.of(ErrorType.MODEL_NOT_FOUND, message);
        }
        if (isStreamDisconnected(message)) {
            return ErrorInfo.of(ErrorType.STREAM_DISCONNECTED, message);
        }
        if (isQuotaExhausted(message)) {
            return ErrorInfo.of(ErrorType.QUOTA_EXHAUSTED, message);
        }
        if (isRateLimit(message)) {
            return new ErrorInfo(ErrorType.RATE_LIMIT, message, extractRetryAfter(message));
        }
        if (abort) {
            return ErrorInfo.of(ErrorType.ABORT, message);
        }
        if (isCancellation(message)) {
            return ErrorInfo.of(ErrorType.CANCELLATION, message);
        }
        return ErrorInfo.of(ErrorType.AGENT_ERROR, message);
    }

    static boolean isAuthentication(String message) {
        return message.contains("Authentication failed")
                || message.contains("Invalid API key")
                || message.contains("authentication_failed")
                || message.contains("Fix external API key");
    }

    static boolean isModelNotFound(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("does not exist or you do not have access")
                || lower.contains("model_not_found")
                || lower.contains("invalid_model")
                || (lower.contains("model") && (lower.contains("does not exist") || lower.contains("not found")));
    }

    static boolean isStreamDisconnected(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("stream disconnected")
                || lower.contains("stream ended")
                || lower.contains("connection reset")
                || lower.contains("socket hang up")
                || lower.contains("econnreset");
    }

    static boolean isQuotaExhausted(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("overloaded")
                || lower.contains("capacity")
                || lower.contains("limit reached")
                || lower.contains("usage limit")
                || lower.contains("quota exceeded")
                || lower.contains("quota_exceeded")
                || lower.contains("session limit")
                || lower.contains("weekly limit")
                || lower.contains("monthly limit")
                || lower.contains("credit balance")
                || lower.contains("insufficient credits")
                || lower.contains("insufficient balance")
                || lower.contains("no credits")
                || lower.contains("out of credits")
                || lower.contains("billing")
                || lower.contains("payment required")
                || lower.contains("/upgrade")
                || lower.contains("extra-usage");
    }

    static boolean isRateLimit(String message) {
        return message.contains("429") || message.contains("rate_limit");
    }

    static boolean isCancellation(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("cancelled")
                || lower.contains("canceled")
                || lower.contains("stopped")
                || lower.contains("aborted");
    }

    static int extractRetryAfter(String message) {
        Matcher m = RETRY_AFTER.matcher(message);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        m = WAIT_SECONDS.matcher(message);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        return DEFAULT_RETRY_AFTER_SECONDS;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
