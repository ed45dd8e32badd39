package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Position of a value relative to its reference range.
 */
public enum Flag {
    LOW("L"),
    NORMAL("N"),
    HIGH("H"),
    UNAVAILABLE("N/A");

    private final String value;

    Flag(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
