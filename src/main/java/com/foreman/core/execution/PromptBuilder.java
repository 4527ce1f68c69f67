package com.foreman.core.execution;

import com.foreman.core.model.Feature;

/**
 * Builds agent prompts for the pipeline steps.
 * Pure functions, no Spring dependencies.
 */
public final class PromptBuilder {

    /** Longest slice of previous output carried into a continuation prompt. */
    static final int MAX_CONTEXT_CHARS = 20_000;

    private PromptBuilder() {}

    public static String featurePrompt(Feature feature) {
        var sb = new StringBuilder();
        sb.append("## Feature Implementation Task\n\n");
        sb.append("**Feature ID:** ").append(feature.id()).append("\n");
        sb.append("**Title:** ").append(feature.displayTitle()).append("\n");
        sb.append("**Description:** ").append(nullToEmpty(feature.description())).append("\n\n");
        appendInstructions(sb, feature);
        return sb.toString();
    }

    public static String planningPrompt(Feature feature) {
        var sb = new StringBuilder();
        sb.append("## Planning Task\n\n");
        sb.append("**Feature ID:** ").append(feature.id()).append("\n");
        sb.append("**Title:** ").append(feature.displayTitle()).append("\n");
        sb.append("**Description:** ").append(nullToEmpty(feature.description())).append("\n\n");
        sb.append("Produce a step-by-step implementation plan for this feature. ");
        sb.append("Do NOT modify any files yet. The plan will be reviewed before implementation starts.\n");
        sb.append("Wrap the plan in <plan></plan> tags.\n");
        return sb.toString();
    }

    public static String continuationAfterApproval(Feature feature, String approvedPlan, String feedback) {
        var sb = new StringBuilder();
        sb.append("## Approved Plan\n\n");
        sb.append("The implementation plan for feature ").append(feature.id())
                .append(" (").append(feature.displayTitle()).append(") has been approved.\n\n");
        if (feedback != null && !feedback.isBlank()) {
            sb.append("**Reviewer feedback:** ").append(feedback).append("\n\n");
        }
        sb.append(nullToEmpty(approvedPlan)).append("\n\n");
        sb.append("Implement the plan now.\n\n");
        appendInstructions(sb, feature);
        return sb.toString();
    }

    public static String continuationFromContext(Feature feature, String previousOutput) {
        String context = previousOutput == null ? "" : previousOutput;
        if (context.length() > MAX_CONTEXT_CHARS) {
            context = context.substring(context.length() - MAX_CONTEXT_CHARS);
        }
        var sb = new StringBuilder();
        sb.append("## Continue Feature Implementation\n\n");
        sb.append(featurePrompt(feature)).append("\n");
        sb.append("## Previous Context\n\n");
        sb.append("A previous session worked on this feature and was interrupted. Its output follows:\n\n");
        sb.append(context).append("\n\n");
        sb.append("Review the previous work, continue from where it left off and complete the feature.\n");
        return sb.toString();
    }

    public static String fixVerification(Feature feature, VerificationResult result, int attempt, int maxAttempts) {
        var sb = new StringBuilder();
        sb.append("## Verification Failed (attempt ").append(attempt).append("/").append(maxAttempts).append(")\n\n");
        sb.append("Feature ").append(feature.id()).append(" was implemented but the command `")
                .append(result.failedCommand()).append("` failed:\n\n");
        sb.append("```\n").append(lastChars(result.output(), MAX_CONTEXT_CHARS / 4)).append("\n```\n\n");
        sb.append("Fix the problems so that verification passes. Do not disable or delete tests.\n");
        return sb.toString();
    }

    private static void appendInstructions(StringBuilder sb, Feature feature) {
        sb.append("## Instructions\n\n");
        sb.append("- Implement the feature described above in this working directory\n");
        sb.append("- Only modify files related to this feature\n");
        if (!feature.skipTests()) {
            sb.append("- Add or update tests covering the change\n");
        }
        sb.append("- When done, write a short summary of the changes inside <summary></summary> tags\n");
    }

    private static String lastChars(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(text.length() - max);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
