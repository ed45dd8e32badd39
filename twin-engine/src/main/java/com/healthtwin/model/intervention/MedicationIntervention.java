package com.healthtwin.model.intervention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * Medication course. The drug class is recognised from the name by substring.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MedicationIntervention(
    String name,
    String dose,
    String frequency
) {

    public static MedicationIntervention named(String name) {
        return new MedicationIntervention(name, null, null);
    }

    public String normalizedName() {
        return name != null ? name.toLowerCase(Locale.ROOT) : "";
    }
}
