package com.healthtwin.service;

import com.healthtwin.model.enums.Gender;
import com.healthtwin.model.parameter.DemographicProfile;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.util.Decimals;

import java.util.Objects;

/**
 * Metrics derived from other snapshot fields.
 *
 * BMI = weight_kg / height_m^2, one decimal.
 * eGFR (MDRD) = 175 * creatinine^-1.154 * age^-0.203 * 0.742 (female), one decimal.
 */
public final class DerivedMetrics {

    static final double MDRD_CONSTANT = 175;
    static final double MDRD_CREATININE_EXPONENT = -1.154;
    static final double MDRD_AGE_EXPONENT = -0.203;
    static final double MDRD_FEMALE_FACTOR = 0.742;

    private DerivedMetrics() {}

    /**
     * Returns null unless both measurements are positive.
     */
    public static Double bmi(Double weightKg, Double heightCm) {
        if (weightKg == null || heightCm == null || weightKg <= 0 || heightCm <= 0) {
            return null;
        }
        double heightM = heightCm / 100;
        return Decimals.round(weightKg / (heightM * heightM), 1);
    }

    /**
     * Stored BMI if present, otherwise computed from height and weight.
     */
    public static Double bmi(ParameterSnapshot snapshot) {
        Double stored = snapshot.number(Parameter.BMI);
        if (stored != null) {
            return stored;
        }
        return bmi(snapshot.number(Parameter.WEIGHT_KG), snapshot.number(Parameter.HEIGHT_CM));
    }

    public static double egfr(double creatinine, int age, Gender gender) {
        double value = MDRD_CONSTANT
            * Math.pow(creatinine, MDRD_CREATININE_EXPONENT)
            * Math.pow(age, MDRD_AGE_EXPONENT);
        if (gender == Gender.FEMALE) {
            value *= MDRD_FEMALE_FACTOR;
        }
        return Decimals.round(value, 1);
    }

    /**
     * eGFR from the snapshot's creatinine and demographics; null when either is unknown.
     */
    public static Double egfr(ParameterSnapshot snapshot) {
        Double creatinine = snapshot.number(Parameter.CREATININE);
        DemographicProfile demographics = snapshot.getDemographics();
        if (creatinine == null || creatinine <= 0 || demographics == null || demographics.age() <= 0) {
            return null;
        }
        return egfr(creatinine, demographics.age(), demographics.gender());
    }

    /**
     * Recomputes BMI on {@code after} when its weight or height differs from {@code before}.
     * When the new measurements no longer yield a BMI (missing or not positive) a stored BMI
     * is marked unavailable. Otherwise returns {@code after} unchanged.
     */
    public static ParameterSnapshot refreshBmi(ParameterSnapshot before, ParameterSnapshot after) {
        boolean bodyChanged = !Objects.equals(before.number(Parameter.WEIGHT_KG), after.number(Parameter.WEIGHT_KG))
            || !Objects.equals(before.number(Parameter.HEIGHT_CM), after.number(Parameter.HEIGHT_CM));
        if (!bodyChanged) {
            return after;
        }
        Double bmi = bmi(after.number(Parameter.WEIGHT_KG), after.number(Parameter.HEIGHT_CM));
        if (bmi != null) {
            return after.with(Parameter.BMI, bmi);
        }
        return after.has(Parameter.BMI) ? after.with(Parameter.BMI, null) : after;
    }
}
