package com.foreman.core.model;

/**
 * Implementation plan produced by the agent in planning mode.
 *
 * @param content  plan text as produced (or edited by the reviewer)
 * @param status   review status
 * @param feedback reviewer feedback, may be null
 */
public record PlanSpec(
    String content,
    PlanStatus status,
    String feedback
) {

    public static PlanSpec generated(String content) {
        return new PlanSpec(content, PlanStatus.GENERATED, null);
    }

    public PlanSpec approved(String editedContent, String feedback) {
        String finalContent = editedContent != null && !editedContent.isBlank() ? editedContent : content;
        return new PlanSpec(finalContent, PlanStatus.APPROVED, feedback);
    }

    public PlanSpec rejected(String feedback) {
        return new PlanSpec(content, PlanStatus.REJECTED, feedback);
    }
}
