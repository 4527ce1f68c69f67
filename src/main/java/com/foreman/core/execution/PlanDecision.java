package com.foreman.core.execution;

/**
 * Reviewer decision on a generated plan.
 */
public record PlanDecision(boolean approved, String editedPlan, String feedback) {}
