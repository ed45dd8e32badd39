package com.healthtwin.model.intervention;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exercise prescription. Only the intensity drives the projected effect.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExerciseIntervention(
    String type,
    String intensity,
    @JsonProperty("duration_minutes")
    Integer durationMinutes,
    @JsonProperty("frequency_per_week")
    Integer frequencyPerWeek
) {

    public static final String DEFAULT_INTENSITY = "moderate";

    public static ExerciseIntervention ofIntensity(String intensity) {
        return new ExerciseIntervention(null, intensity, null, null);
    }

    public String effectiveIntensity() {
        return intensity != null ? intensity : DEFAULT_INTENSITY;
    }

    @JsonIgnore
    public boolean isCardioEffective() {
        String level = effectiveIntensity();
        return "moderate".equals(level) || "vigorous".equals(level);
    }
}
