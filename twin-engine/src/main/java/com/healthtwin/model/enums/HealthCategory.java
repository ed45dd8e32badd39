package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall health classification bands.
 *   Excellent: 90-100
 *   Good:      75-89
 *   Fair:      60-74
 *   Poor:      40-59
 *   Critical:  0-39
 */
public enum HealthCategory {
    EXCELLENT(90, 100, "excellent"),
    GOOD(75, 89, "good"),
    FAIR(60, 74, "fair"),
    POOR(40, 59, "poor"),
    CRITICAL(0, 39, "critical");

    private final int minScore;
    private final int maxScore;
    private final String value;

    HealthCategory(int minScore, int maxScore, String value) {
        this.minScore = minScore;
        this.maxScore = maxScore;
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static HealthCategory fromScore(int score) {
        for (HealthCategory category : values()) {
            if (score >= category.minScore && score <= category.maxScore) {
                return category;
            }
        }
        return CRITICAL;
    }
}
