package com.foreman.core.settings;

import com.foreman.core.model.PartitionKey;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link SettingsProvider} backed by {@link AutoModeProperties}.
 */
@Component
public class PropertiesSettingsProvider implements SettingsProvider {

    private final AutoModeProperties properties;

    public PropertiesSettingsProvider(AutoModeProperties properties) {
        this.properties = properties;
    }

    @Override
    public GlobalSettings getGlobalSettings() {
        var autoMode = properties.getAutoMode();
        Map<PartitionKey, WorktreeAutoModeSettings> overrides = new HashMap<>();
        for (var override : autoMode.getWorktrees()) {
            if (override.getProjectPath() == null || override.getProjectPath().isBlank()) {
                continue;
            }
            overrides.put(PartitionKey.of(override.getProjectPath(), override.getBranchName()),
                    new WorktreeAutoModeSettings(override.getMaxConcurrency()));
        }
        return new GlobalSettings(autoMode.getMaxConcurrency(), overrides);
    }
}
