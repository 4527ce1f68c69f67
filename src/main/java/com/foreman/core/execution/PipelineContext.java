package com.foreman.core.execution;

import com.foreman.core.concurrency.RunningFeature;
import com.foreman.core.model.Feature;

import java.nio.file.Path;

/**
 * Everything a pipeline run needs.
 *
 * @param continuationPrompt prompt that replaces the feature prompt, null for a fresh run
 */
public record PipelineContext(
    String projectPath,
    Feature feature,
    Path workDir,
    RunningFeature runningFeature,
    String continuationPrompt
) {}
