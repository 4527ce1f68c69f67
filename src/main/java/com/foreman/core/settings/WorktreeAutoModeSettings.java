package com.foreman.core.settings;

/**
 * Auto mode settings for one worktree. A null concurrency falls back to the global value.
 */
public record WorktreeAutoModeSettings(Integer maxConcurrency) {}
