package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk level attached to a simulation scenario.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RiskLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RiskLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown RiskLevel: " + value);
    }
}
