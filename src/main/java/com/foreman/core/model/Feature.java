package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * A unit of work executed autonomously by an AI coding agent.
 *
 * @param id                  unique identifier within a project
 * @param title               short human-readable title
 * @param description         what the agent should implement
 * @param status              lifecycle status
 * @param priority            lower is more urgent; null means {@link #DEFAULT_PRIORITY}
 * @param dependencies        ids of features that must be completed or verified first
 * @param branchName          branch the feature belongs to; null means the main worktree
 * @param model               model alias or id requested for this feature, may be null
 * @param skipTests           when true verification is skipped and the feature ends in waiting_approval
 * @param requirePlanApproval when true the agent's plan must be approved before implementation
 * @param planSpec            current plan, may be null
 * @param summary             summary extracted from the last agent run
 * @param error               last failure message
 * @param startedAt           when the current or last execution started
 * @param updatedAt           last time the feature was written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Feature(
    String id,
    String title,
    String description,
    FeatureStatus status,
    Integer priority,
    List<String> dependencies,
    String branchName,
    String model,
    boolean skipTests,
    boolean requirePlanApproval,
    PlanSpec planSpec,
    String summary,
    String error,
    Instant startedAt,
    Instant updatedAt
) {

    public static final int DEFAULT_PRIORITY = 2;

    public Feature {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        status = status == null ? FeatureStatus.BACKLOG : status;
    }

    /** Creates a minimal feature in the given status; convenient for stores and tests. */
    public static Feature of(String id, FeatureStatus status) {
        return new Feature(id, null, null, status, null, List.of(), null, null,
                false, false, null, null, null, null, null);
    }

    @JsonIgnore
    public int effectivePriority() {
        return priority != null ? priority : DEFAULT_PRIORITY;
    }

    @JsonIgnore
    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (description == null || description.isBlank()) {
            return "Untitled Feature";
        }
        String firstLine = description.split("\n")[0].trim();
        return firstLine.length() <= 60 ? firstLine : firstLine.substring(0, 57) + "...";
    }

    public Feature withStatus(FeatureStatus newStatus) {
        return new Feature(id, title, description, newStatus, priority, dependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withPriority(Integer newPriority) {
        return new Feature(id, title, description, status, newPriority, dependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withDependencies(List<String> newDependencies) {
        return new Feature(id, title, description, status, priority, newDependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withBranchName(String newBranchName) {
        return new Feature(id, title, description, status, priority, dependencies, newBranchName, model,
                skipTests, requirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withModel(String newModel) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, newModel,
                skipTests, requirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withSkipTests(boolean newSkipTests) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                newSkipTests, requirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withRequirePlanApproval(boolean newRequirePlanApproval) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                skipTests, newRequirePlanApproval, planSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withPlanSpec(PlanSpec newPlanSpec) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                skipTests, requirePlanApproval, newPlanSpec, summary, error, startedAt, updatedAt);
    }

    public Feature withSummary(String newSummary) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, newSummary, error, startedAt, updatedAt);
    }

    public Feature withError(String newError) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, summary, newError, startedAt, updatedAt);
    }

    public Feature withStartedAt(Instant newStartedAt) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, summary, error, newStartedAt, updatedAt);
    }

    public Feature withUpdatedAt(Instant newUpdatedAt) {
        return new Feature(id, title, description, status, priority, dependencies, branchName, model,
                skipTests, requirePlanApproval, planSpec, summary, error, startedAt, newUpdatedAt);
    }
}
