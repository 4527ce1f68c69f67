package com.foreman.core.engine;

import com.foreman.core.model.PartitionKey;

import java.util.List;

/**
 * Server-wide view: every running feature and every active loop.
 */
public record AutoModeStatus(
    boolean isRunning,
    int runningCount,
    List<String> runningFeatures,
    List<String> activeProjects,
    List<PartitionKey> activeWorktrees
) {}
