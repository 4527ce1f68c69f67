package com.foreman.core.error;

/**
 * Thrown when the feature store cannot read or write a feature.
 */
public class FeatureStoreException extends RuntimeException {

    public FeatureStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
