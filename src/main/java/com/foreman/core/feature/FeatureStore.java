package com.foreman.core.feature;

import com.foreman.core.model.Feature;
import com.foreman.core.model.FeatureStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of features and their agent output, scoped by project.
 */
public interface FeatureStore {

    Optional<Feature> load(String projectPath, String featureId);

    /** All features of a project in a stable order (by id). */
    List<Feature> loadAll(String projectPath);

    Feature save(String projectPath, Feature feature);

    /**
     * Sets the status of a feature and returns the updated feature.
     *
     * @throws com.foreman.core.error.FeatureNotFoundException if the feature does not exist
     */
    Feature updateStatus(String projectPath, String featureId, FeatureStatus status);

    void appendAgentOutput(String projectPath, String featureId, String text);

    Optional<String> readAgentOutput(String projectPath, String featureId);
}
