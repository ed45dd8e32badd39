package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Expected movement of a parameter under a medication.
 */
public enum ChangeDirection {
    NEGATIVE("negative"),
    POSITIVE("positive"),
    NORMALIZE("normalize");

    private final String value;

    ChangeDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
