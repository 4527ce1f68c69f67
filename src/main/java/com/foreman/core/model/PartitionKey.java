package com.foreman.core.model;

import java.util.Objects;

/**
 * Isolation partition: a project plus a branch, where a null branch is the main worktree.
 * <p>
 * This is the unit of concurrency accounting and of independent scheduling loops.
 * Callers that know the repository's primary branch should build keys with
 * {@link #normalized(String, String, String)} so that the primary branch maps to main.
 */
public record PartitionKey(String projectPath, String branchName) {

    private static final String MAIN_MARKER = "__main__";

    public PartitionKey {
        Objects.requireNonNull(projectPath, "projectPath");
        if (branchName != null && branchName.isBlank()) {
            branchName = null;
        }
    }

    public static PartitionKey of(String projectPath, String branchName) {
        return new PartitionKey(projectPath, branchName);
    }

    public static PartitionKey main(String projectPath) {
        return new PartitionKey(projectPath, null);
    }

    /**
     * Builds a key, mapping {@code branchName} to main when it equals {@code primaryBranch}.
     */
    public static PartitionKey normalized(String projectPath, String branchName, String primaryBranch) {
        if (branchName != null && branchName.equals(primaryBranch)) {
            return main(projectPath);
        }
        return new PartitionKey(projectPath, branchName);
    }

    public boolean isMain() {
        return branchName == null;
    }

    /** Human-readable form for logs and thread names; never used as a map key. */
    public String displayName() {
        return projectPath + "::" + (branchName == null ? MAIN_MARKER : branchName);
    }

    /** Describes the worktree for user-facing messages. */
    public String describeWorktree() {
        return branchName == null ? "main worktree" : "worktree " + branchName;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
