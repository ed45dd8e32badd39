package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Focus areas offered for a health consultation.
 */
public enum ConsultationType {
    GENERAL("general"),
    LIFESTYLE("lifestyle"),
    NUTRITION("nutrition"),
    EXERCISE("exercise"),
    COMPREHENSIVE("comprehensive");

    private final String value;

    ConsultationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConsultationType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ConsultationType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ConsultationType: " + value);
    }
}
