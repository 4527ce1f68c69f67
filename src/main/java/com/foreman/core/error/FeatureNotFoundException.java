package com.foreman.core.error;

public class FeatureNotFoundException extends RuntimeException {

    private final String featureId;

    public FeatureNotFoundException(String featureId) {
        super("Feature " + featureId + " not found");
        this.featureId = featureId;
    }

    public String getFeatureId() {
        return featureId;
    }
}
