package com.foreman.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for running or resuming a single feature.
 *
 * @param useWorktrees nullable, defaults to the configured value
 */
public record FeatureRunRequest(
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("use_worktrees") Boolean useWorktrees
) {}
