package com.foreman.core.engine;

public record WorktreeCapacity(
    boolean hasCapacity,
    int currentAgents,
    int maxAgents,
    String branchName
) {}
