package com.foreman.core.execution;

import com.foreman.core.error.ErrorInfo;

/**
 * Final outcome of a feature execution.
 *
 * @param error set for FAILED and CANCELLED
 */
public record PipelineResult(Outcome outcome, ErrorInfo error, String summary) {

    public enum Outcome { SUCCEEDED, NEEDS_APPROVAL, FAILED, CANCELLED }

    public static PipelineResult succeeded(String summary) {
        return new PipelineResult(Outcome.SUCCEEDED, null, summary);
    }

    public static PipelineResult needsApproval(String summary) {
        return new PipelineResult(Outcome.NEEDS_APPROVAL, null, summary);
    }

    public static PipelineResult failed(ErrorInfo error) {
        return new PipelineResult(Outcome.FAILED, error, null);
    }

    public static PipelineResult cancelled(ErrorInfo error) {
        return new PipelineResult(Outcome.CANCELLED, error, null);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED || outcome == Outcome.NEEDS_APPROVAL;
    }
}
