package com.foreman.core.engine;

import java.time.Instant;

public record RunningAgentInfo(
    String featureId,
    String projectPath,
    String projectName,
    String branchName,
    boolean isAutoMode,
    String model,
    String provider,
    Instant startTime,
    String title,
    String description
) {}
