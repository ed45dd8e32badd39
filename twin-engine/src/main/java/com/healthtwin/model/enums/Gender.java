package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Administrative gender of the modelled patient.
 * Drives the sex-specific CBC and HDL draws and the MDRD eGFR factor.
 */
public enum Gender {
    MALE("M", "male"),
    FEMALE("F", "female");

    private final String code;
    private final String label;

    Gender(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }

    /**
     * Accepts either the single-letter code ("M", "F") or the full label.
     */
    @JsonCreator
    public static Gender fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Gender gender : values()) {
            if (gender.code.equalsIgnoreCase(value) || gender.label.equalsIgnoreCase(value)) {
                return gender;
            }
        }
        throw new IllegalArgumentException("Unknown Gender: " + value);
    }
}
