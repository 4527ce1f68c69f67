package com.foreman.core.engine;

import java.util.List;

/**
 * Status of one partition.
 *
 * @param maxConcurrency limit of the running loop, or the resolved limit when no loop runs
 */
public record ProjectStatus(
    String projectPath,
    String branchName,
    boolean isAutoLoopRunning,
    int runningCount,
    List<String> runningFeatures,
    int maxConcurrency
) {}
