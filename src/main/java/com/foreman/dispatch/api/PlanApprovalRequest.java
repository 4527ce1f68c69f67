package com.foreman.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reviewer decision on a generated plan.
 *
 * @param editedPlan replacement plan text; nullable, keeps the generated plan
 */
public record PlanApprovalRequest(
    @JsonProperty("project_path") String projectPath,
    boolean approved,
    @JsonProperty("edited_plan") String editedPlan,
    String feedback
) {}
