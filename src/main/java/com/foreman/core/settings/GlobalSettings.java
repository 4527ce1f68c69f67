package com.foreman.core.settings;

import com.foreman.core.model.PartitionKey;

import java.util.Map;

/**
 * Settings snapshot consulted when an auto loop starts.
 *
 * @param maxConcurrency     global default, may be null
 * @param autoModeByWorktree per-partition overrides
 */
public record GlobalSettings(
    Integer maxConcurrency,
    Map<PartitionKey, WorktreeAutoModeSettings> autoModeByWorktree
) {

    public GlobalSettings {
        autoModeByWorktree = autoModeByWorktree == null ? Map.of() : Map.copyOf(autoModeByWorktree);
    }
}
