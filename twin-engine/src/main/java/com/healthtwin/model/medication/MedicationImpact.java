package com.healthtwin.model.medication;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthtwin.model.enums.DrugClass;
import com.healthtwin.model.parameter.Parameter;

import java.util.Map;

/**
 * Predicted effects of a named medication on a baseline. When nothing could be predicted
 * the effects are empty and {@code note} explains why, with its own confidence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MedicationImpact(
    String medicationName,
    DrugClass drugClass,
    Map<Parameter, MedicationEffect> effects,
    String note,
    Integer noteConfidence
) {

    public boolean hasPredictions() {
        return !effects.isEmpty();
    }
}
