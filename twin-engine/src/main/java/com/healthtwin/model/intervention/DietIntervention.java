package com.healthtwin.model.intervention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Dietary change. Modelled types are "low_carb", "mediterranean" and "low_sodium";
 * anything else (the default is "balanced") has no projected effect.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DietIntervention(String type) {

    public static final String DEFAULT_TYPE = "balanced";

    public String effectiveType() {
        return type != null ? type : DEFAULT_TYPE;
    }
}
