package com.healthtwin.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Drug classes recognised by the medication impact predictor.
 * A drug name matches a class when it contains one of the class fragments; classes are
 * tried in declaration order.
 */
public enum DrugClass {
    STATIN("statin", List.of("atorvastatin", "simvastatin", "rosuvastatin", "pravastatin", "lovastatin", "statin")),
    ACE_INHIBITOR("ace_inhibitor", List.of("lisinopril", "enalapril", "captopril", "ramipril", "benazepril", "pril")),
    METFORMIN("metformin", List.of("metformin", "glucophage")),
    BETA_BLOCKER("beta_blocker", List.of("metoprolol", "atenolol", "propranolol", "carvedilol", "olol")),
    THYROID_REPLACEMENT("thyroid_replacement", List.of("levothyroxine", "synthroid", "armour")),
    DIURETIC("diuretic", List.of("hydrochlorothiazide", "furosemide", "spironolactone", "thiazide"));

    private final String value;
    private final List<String> fragments;

    DrugClass(String value, List<String> fragments) {
        this.value = value;
        this.fragments = fragments;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns null when the name matches no known class.
     */
    public static DrugClass fromDrugName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (DrugClass drugClass : values()) {
            for (String fragment : drugClass.fragments) {
                if (normalized.contains(fragment)) {
                    return drugClass;
                }
            }
        }
        return null;
    }
}
