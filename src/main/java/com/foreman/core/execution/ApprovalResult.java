package com.foreman.core.execution;

/**
 * Outcome of resolving a plan approval.
 *
 * @param success       whether the decision was accepted
 * @param needsRecovery true when no execution was waiting but the persisted feature is awaiting
 *                      approval, so the caller must restart execution itself
 * @param error         reason when not successful
 */
public record ApprovalResult(boolean success, boolean needsRecovery, String error) {

    public static ApprovalResult resolved() {
        return new ApprovalResult(true, false, null);
    }

    public static ApprovalResult recovery() {
        return new ApprovalResult(true, true, null);
    }

    public static ApprovalResult failed(String error) {
        return new ApprovalResult(false, false, error);
    }
}
