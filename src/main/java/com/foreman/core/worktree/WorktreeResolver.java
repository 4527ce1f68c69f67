package com.foreman.core.worktree;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves git worktree information for a project.
 */
public interface WorktreeResolver {

    /**
     * Returns the branch checked out in the project's main worktree,
     * or null when it cannot be determined (not a repository, detached HEAD).
     */
    String getPrimaryBranch(String projectPath);

    /** Finds the working directory of the worktree that has {@code branchName} checked out. */
    Optional<Path> findWorktreePath(String projectPath, String branchName);

    boolean branchExists(String projectPath, String branchName);
}
