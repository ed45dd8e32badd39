package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.ChangeDirection;
import com.healthtwin.model.enums.DrugClass;
import com.healthtwin.model.medication.MedicationEffect;
import com.healthtwin.model.medication.MedicationImpact;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

import static com.healthtwin.model.enums.ChangeDirection.*;
import static com.healthtwin.model.parameter.Parameter.*;

/**
 * Medication Impact Service
 *
 * Predicts how a named drug moves the baseline, by drug class:
 * - statin: total cholesterol, LDL down; ALT slightly up
 * - ACE inhibitor: blood pressure down, potassium up to 5.0
 * - metformin: fasting glucose and HbA1c down
 * - beta blocker: heart rate and systolic pressure down
 * - thyroid replacement: TSH normalized to 2.5
 * - diuretic: systolic down; potassium up (spironolactone) or down (others)
 *
 * Predicted values are rounded to one decimal.
 */
@Slf4j
@Service
public class MedicationImpactService {

    static final int NOTE_CONFIDENCE = 50;
    static final double TARGET_TSH = 2.5;

    public MedicationImpact predict(ParameterSnapshot baseline, String medicationName) {
        if (baseline == null) {
            throw new InvalidSimulationInputException("Baseline parameters are required");
        }
        if (medicationName == null || medicationName.isBlank()) {
            throw new InvalidSimulationInputException("Medication name is required");
        }

        DrugClass drugClass = DrugClass.fromDrugName(medicationName);
        Map<Parameter, MedicationEffect> effects = new LinkedHashMap<>();
        if (drugClass != null) {
            predictClass(drugClass, medicationName.toLowerCase(Locale.ROOT), baseline, effects);
        }

        if (effects.isEmpty()) {
            log.debug("No predictable effects for medication '{}'", medicationName);
            String note = "Specific predictions for " + medicationName
                + " require more detailed pharmacological analysis.";
            return new MedicationImpact(medicationName, drugClass, Map.of(), note, NOTE_CONFIDENCE);
        }
        return new MedicationImpact(medicationName, drugClass, Collections.unmodifiableMap(effects), null, null);
    }

    private void predictClass(DrugClass drugClass, String name, ParameterSnapshot baseline,
                              Map<Parameter, MedicationEffect> effects) {
        switch (drugClass) {
            case STATIN -> {
                add(effects, baseline, TOTAL_CHOLESTEROL, x -> Math.max(x * 0.7, x - 60), NEGATIVE, 85);
                add(effects, baseline, LDL, x -> Math.max(x * 0.6, x - 50), NEGATIVE, 90);
                add(effects, baseline, ALT, x -> Math.min(x * 1.2, x + 10), POSITIVE, 70);
            }
            case ACE_INHIBITOR -> {
                add(effects, baseline, BLOOD_PRESSURE_SYSTOLIC, x -> Math.max(x - 15, 110), NEGATIVE, 85);
                add(effects, baseline, BLOOD_PRESSURE_DIASTOLIC, x -> Math.max(x - 10, 70), NEGATIVE, 85);
                add(effects, baseline, POTASSIUM, x -> Math.min(x + 0.3, 5.0), POSITIVE, 75);
            }
            case METFORMIN -> {
                add(effects, baseline, GLUCOSE_FASTING, x -> Math.max(x * 0.8, x - 30), NEGATIVE, 90);
                add(effects, baseline, HBA1C, x -> Math.max(x - 0.8, 5.0), NEGATIVE, 85);
            }
            case BETA_BLOCKER -> {
                add(effects, baseline, HEART_RATE, x -> Math.max(x - 15, 55), NEGATIVE, 90);
                add(effects, baseline, BLOOD_PRESSURE_SYSTOLIC, x -> Math.max(x - 12, 110), NEGATIVE, 80);
            }
            case THYROID_REPLACEMENT -> add(effects, baseline, TSH, x -> TARGET_TSH, NORMALIZE, 85);
            case DIURETIC -> {
                add(effects, baseline, BLOOD_PRESSURE_SYSTOLIC, x -> Math.max(x - 10, 110), NEGATIVE, 80);
                if (name.contains("spironolactone")) {
                    add(effects, baseline, POTASSIUM, x -> Math.min(x + 0.4, 5.0), POSITIVE, 75);
                } else {
                    add(effects, baseline, POTASSIUM, x -> Math.max(x - 0.3, 3.5), NEGATIVE, 75);
                }
            }
        }
    }

    private void add(Map<Parameter, MedicationEffect> effects, ParameterSnapshot baseline, Parameter parameter,
                     DoubleUnaryOperator formula, ChangeDirection direction, int confidence) {
        Double before = baseline.number(parameter);
        if (before == null) {
            return;
        }
        double after = formula.applyAsDouble(before);
        effects.put(parameter, MedicationEffect.predict(before, after, parameter.getUnit(), direction, confidence));
    }
}
