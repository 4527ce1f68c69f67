package com.foreman.core.model;

/**
 * Effective configuration of a running auto loop.
 *
 * @param maxConcurrency maximum features running at once in the partition
 * @param useWorktrees   whether features execute in their branch worktree
 * @param projectPath    project the loop belongs to
 * @param branchName     branch of the loop, null for the main worktree
 */
public record AutoModeConfig(
    int maxConcurrency,
    boolean useWorktrees,
    String projectPath,
    String branchName
) {

    public PartitionKey partitionKey() {
        return PartitionKey.of(projectPath, branchName);
    }
}
