package com.foreman.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/auto-mode/start and /stop.
 *
 * @param projectPath    absolute path to the project directory
 * @param branchName     worktree branch; nullable, defaults to the main worktree
 * @param maxConcurrency concurrency limit; nullable, resolved from settings (ignored by stop)
 */
public record AutoModeRequest(
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("branch_name") String branchName,
    @JsonProperty("max_concurrency") Integer maxConcurrency
) {}
