package com.foreman.core.scheduler;

import com.foreman.core.error.ErrorInfo;

/**
 * Receives execution outcomes for the partition a feature ran in.
 */
public interface FailureTracker {

    /**
     * Records a failure and reports whether the partition's loop should pause.
     * Returns false when no loop is running for the partition.
     */
    boolean trackFailureAndCheckPause(String projectPath, String branchName, ErrorInfo errorInfo);

    void signalShouldPause(String projectPath, String branchName, ErrorInfo errorInfo);

    void recordSuccess(String projectPath, String branchName);
}
