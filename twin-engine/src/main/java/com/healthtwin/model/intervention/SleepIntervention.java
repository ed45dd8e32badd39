package com.healthtwin.model.intervention;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Sleep improvement target: "mild", "moderate" (default) or "significant".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SleepIntervention(String improvement) {

    public static final String DEFAULT_IMPROVEMENT = "moderate";

    @JsonIgnore
    public boolean isEffective() {
        String level = improvement != null ? improvement : DEFAULT_IMPROVEMENT;
        return "moderate".equals(level) || "significant".equals(level);
    }
}
