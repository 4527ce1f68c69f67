package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Persisted scheduling configuration of one partition, used to restore loops after a restart.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionState(
    String projectPath,
    String branchName,
    int maxConcurrency,
    Instant savedAt
) {

    @JsonIgnore
    public PartitionKey partitionKey() {
        return PartitionKey.of(projectPath, branchName);
    }
}
