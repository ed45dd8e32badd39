package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Parameter groups of a physiological snapshot.
 * The scoring weight is zero for categories that are not scored on their own.
 */
public enum ParameterCategory {
    VITALS("vitals", 0.25),
    CBC("cbc", 0.05),
    METABOLIC("metabolic", 0.25),
    LIPIDS("lipids", 0.20),
    LIVER("liver", 0.03),
    THYROID("thyroid", 0.02),
    LIFESTYLE("lifestyle", 0.20),
    PHYSICAL("physical", 0.0);

    private final String value;
    private final double scoreWeight;

    ParameterCategory(String value, double scoreWeight) {
        this.value = value;
        this.scoreWeight = scoreWeight;
    }

    @JsonKey
    @JsonValue
    public String getValue() {
        return value;
    }

    public double getScoreWeight() {
        return scoreWeight;
    }

    public boolean isScored() {
        return scoreWeight > 0;
    }

    @Override
    public String toString() {
        return value;
    }

    /**
     * Returns null for names outside the vocabulary so callers can skip them.
     */
    public static ParameterCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ParameterCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        return null;
    }
}
