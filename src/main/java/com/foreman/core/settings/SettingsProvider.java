package com.foreman.core.settings;

/**
 * Source of user settings that influence scheduling.
 */
@FunctionalInterface
public interface SettingsProvider {

    GlobalSettings getGlobalSettings();
}
