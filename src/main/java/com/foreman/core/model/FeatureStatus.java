package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a feature. Serialized as the lower-snake-case wire value.
 */
public enum FeatureStatus {
    BACKLOG("backlog"),
    READY("ready"),
    IN_PROGRESS("in_progress"),
    WAITING_APPROVAL("waiting_approval"),
    COMPLETED("completed"),
    VERIFIED("verified"),
    FAILED("failed"),
    INTERRUPTED("interrupted");

    private final String value;

    FeatureStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** True for statuses the scheduler may pick up. */
    public boolean isPending() {
        return this == BACKLOG || this == READY;
    }

    /** True for statuses that satisfy a dependency. */
    public boolean isTerminalSuccess() {
        return this == COMPLETED || this == VERIFIED;
    }

    @JsonCreator
    public static FeatureStatus fromValue(String value) {
        if (value == null) {
            return BACKLOG;
        }
        for (FeatureStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown feature status: " + value);
    }
}
