package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a feature's implementation plan when plan approval is required.
 */
public enum PlanStatus {
    PENDING,
    GENERATED,
    APPROVED,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PlanStatus fromValue(String value) {
        return value == null ? PENDING : valueOf(value.toUpperCase());
    }
}
