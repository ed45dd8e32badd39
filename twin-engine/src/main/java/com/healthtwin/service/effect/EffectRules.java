package com.healthtwin.service.effect;

import com.healthtwin.model.intervention.DietIntervention;
import com.healthtwin.model.intervention.ExerciseIntervention;
import com.healthtwin.model.intervention.MedicationIntervention;
import com.healthtwin.model.intervention.SleepIntervention;

import java.util.List;

import static com.healthtwin.model.parameter.Parameter.*;
import static com.healthtwin.service.effect.EffectRule.*;

/**
 * Heuristic effect table per intervention kind.
 */
public final class EffectRules {

    static final double PREDIABETIC_HBA1C = 5.7;

    static final List<EffectRule> CARDIO_EXERCISE = List.of(
        lower(HEART_RATE, 5, 15),
        lower(BLOOD_PRESSURE_SYSTOLIC, 8, 20),
        lower(BLOOD_PRESSURE_DIASTOLIC, 5, 12),
        raise(HDL, 5, 15),
        lower(TRIGLYCERIDES, 20, 50),
        lower(GLUCOSE_FASTING, 8, 20),
        lowerAbove(HBA1C, 0.3, 0.8, PREDIABETIC_HBA1C)
    );

    static final List<EffectRule> LOW_CARB_DIET = List.of(
        lower(GLUCOSE_FASTING, 10, 25),
        lower(TRIGLYCERIDES, 25, 60)
    );

    static final List<EffectRule> MEDITERRANEAN_DIET = List.of(
        lower(LDL, 15, 35),
        raise(HDL, 8, 20)
    );

    static final List<EffectRule> LOW_SODIUM_DIET = List.of(
        lower(BLOOD_PRESSURE_SYSTOLIC, 10, 25),
        lower(BLOOD_PRESSURE_DIASTOLIC, 6, 15)
    );

    static final List<EffectRule> STATIN = List.of(
        lower(LDL, 30, 70),
        lower(TOTAL_CHOLESTEROL, 25, 60)
    );

    static final List<EffectRule> BLOOD_PRESSURE_MEDICATION = List.of(
        lower(BLOOD_PRESSURE_SYSTOLIC, 15, 35),
        lower(BLOOD_PRESSURE_DIASTOLIC, 8, 20)
    );

    static final List<EffectRule> METFORMIN = List.of(
        lower(GLUCOSE_FASTING, 20, 45),
        lowerAbove(HBA1C, 0.8, 1.5, PREDIABETIC_HBA1C)
    );

    static final List<EffectRule> SLEEP = List.of(
        lower(BLOOD_PRESSURE_SYSTOLIC, 5, 12),
        lower(STRESS_LEVEL, 2, 5)
    );

    private EffectRules() {}

    public static List<EffectRule> forExercise(ExerciseIntervention exercise) {
        return exercise.isCardioEffective() ? CARDIO_EXERCISE : List.of();
    }

    public static List<EffectRule> forDiet(DietIntervention diet) {
        return switch (diet.effectiveType()) {
            case "low_carb" -> LOW_CARB_DIET;
            case "mediterranean" -> MEDITERRANEAN_DIET;
            case "low_sodium" -> LOW_SODIUM_DIET;
            default -> List.of();
        };
    }

    /**
     * First matching drug class by substring of the lower-cased name. Note that "arb" also
     * matches names such as "carbamazepine".
     */
    public static List<EffectRule> forMedication(MedicationIntervention medication) {
        String name = medication.normalizedName();
        if (name.contains("statin")) {
            return STATIN;
        } else if (name.contains("ace_inhibitor") || name.contains("ace-inhibitor") || name.contains("arb")) {
            return BLOOD_PRESSURE_MEDICATION;
        } else if (name.contains("metformin")) {
            return METFORMIN;
        }
        return List.of();
    }

    public static List<EffectRule> forSleep(SleepIntervention sleep) {
        return sleep.isEffective() ? SLEEP : List.of();
    }
}
