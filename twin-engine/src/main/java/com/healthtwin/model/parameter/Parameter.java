package com.healthtwin.model.parameter;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;
import com.healthtwin.model.enums.ParameterCategory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.healthtwin.model.enums.ParameterCategory.*;

/**
 * Reference catalog: the closed vocabulary of snapshot parameters.
 *
 * Each constant binds a wire key to its category, display unit and normal range.
 * Categorical lifestyle parameters carry their allowed labels instead of a range;
 * height and weight carry no range at all.
 */
public enum Parameter {

    // Vital signs
    HEART_RATE(VITALS, "heart_rate", "BPM", 60, 100),
    BLOOD_PRESSURE_SYSTOLIC(VITALS, "blood_pressure_systolic", "mmHg", 90, 140),
    BLOOD_PRESSURE_DIASTOLIC(VITALS, "blood_pressure_diastolic", "mmHg", 60, 90),
    RESPIRATORY_RATE(VITALS, "respiratory_rate", "breaths/min", 12, 20),
    BODY_TEMPERATURE(VITALS, "body_temperature", "°C", 36.5, 37.5),
    OXYGEN_SATURATION(VITALS, "oxygen_saturation", "%", 95, 100),

    // Complete blood count
    HEMOGLOBIN(CBC, "hemoglobin", "g/dL", 12.0, 16.0),
    WHITE_BLOOD_CELLS(CBC, "white_blood_cells", "K/μL", 4.0, 11.0),
    PLATELETS(CBC, "platelets", "K/μL", 150, 450),
    RED_BLOOD_CELLS(CBC, "red_blood_cells", "M/μL", 4.0, 5.5),

    // Metabolic panel
    GLUCOSE_FASTING(METABOLIC, "glucose_fasting", "mg/dL", 70, 100),
    GLUCOSE_RANDOM(METABOLIC, "glucose_random", "mg/dL", 70, 140),
    HBA1C(METABOLIC, "hba1c", "%", 4.0, 5.7),
    CREATININE(METABOLIC, "creatinine", "mg/dL", 0.6, 1.2),
    BUN(METABOLIC, "bun", "mg/dL", 7, 20),
    SODIUM(METABOLIC, "sodium", "mEq/L", 135, 145),
    POTASSIUM(METABOLIC, "potassium", "mEq/L", 3.5, 5.0),
    CHLORIDE(METABOLIC, "chloride", "mEq/L", 96, 106),
    BICARBONATE(METABOLIC, "bicarbonate", "mEq/L", 22, 28),

    // Lipid profile
    TOTAL_CHOLESTEROL(LIPIDS, "total_cholesterol", "mg/dL", 0, 200),
    LDL(LIPIDS, "ldl", "mg/dL", 0, 100),
    HDL(LIPIDS, "hdl", "mg/dL", 40, 60),
    TRIGLYCERIDES(LIPIDS, "triglycerides", "mg/dL", 0, 150),

    // Liver function
    ALT(LIVER, "alt", "U/L", 7, 55),
    AST(LIVER, "ast", "U/L", 8, 48),
    BILIRUBIN(LIVER, "bilirubin", "mg/dL", 0.3, 1.2),
    ALBUMIN(LIVER, "albumin", "g/dL", 3.4, 5.4),

    // Thyroid function
    TSH(THYROID, "tsh", "μIU/mL", 0.4, 4.0),
    T3(THYROID, "t3", "pg/mL", 2.3, 4.2),
    T4(THYROID, "t4", "ng/dL", 0.8, 1.8),

    // Lifestyle
    DIET_CARBS_PERCENT(LIFESTYLE, "diet_carbs_percent", "%", 45, 65),
    DIET_FATS_PERCENT(LIFESTYLE, "diet_fats_percent", "%", 20, 35),
    DIET_PROTEIN_PERCENT(LIFESTYLE, "diet_protein_percent", "%", 10, 35),
    CALORIE_INTAKE(LIFESTYLE, "calorie_intake", "kcal/day", 1600, 3000),
    EXERCISE_FREQUENCY(LIFESTYLE, "exercise_frequency", "days/week", 3, 7),
    EXERCISE_DURATION(LIFESTYLE, "exercise_duration", "min", 30, 60),
    SLEEP_DURATION(LIFESTYLE, "sleep_duration", "hours", 7, 9),
    SLEEP_QUALITY(LIFESTYLE, "sleep_quality", "/10", 6, 10),
    STRESS_LEVEL(LIFESTYLE, "stress_level", "/10", 1, 5),
    SMOKING_STATUS(LIFESTYLE, "smoking_status", List.of("never", "former", "current")),
    ALCOHOL_CONSUMPTION(LIFESTYLE, "alcohol_consumption", List.of("none", "moderate", "heavy")),

    // Physical measurements
    HEIGHT_CM(PHYSICAL, "height_cm", "cm"),
    WEIGHT_KG(PHYSICAL, "weight_kg", "kg"),
    BMI(PHYSICAL, "bmi", "kg/m²", 18.5, 24.9);

    private static final Map<String, Parameter> BY_KEY = new HashMap<>();

    static {
        for (Parameter parameter : values()) {
            BY_KEY.put(parameter.key, parameter);
        }
    }

    private final ParameterCategory category;
    private final String key;
    private final String unit;
    private final ReferenceRange range;
    private final List<String> labels;

    Parameter(ParameterCategory category, String key, String unit, double min, double max) {
        this(category, key, unit, ReferenceRange.of(min, max), List.of());
    }

    Parameter(ParameterCategory category, String key, String unit) {
        this(category, key, unit, null, List.of());
    }

    Parameter(ParameterCategory category, String key, List<String> labels) {
        this(category, key, "", null, labels);
    }

    Parameter(ParameterCategory category, String key, String unit, ReferenceRange range, List<String> labels) {
        this.category = category;
        this.key = key;
        this.unit = unit;
        this.range = range;
        this.labels = labels;
    }

    public ParameterCategory getCategory() {
        return category;
    }

    @JsonKey
    @JsonValue
    public String getKey() {
        return key;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * Normal range, or null for categorical parameters and raw body measurements.
     */
    public ReferenceRange getRange() {
        return range;
    }

    public List<String> getLabels() {
        return labels;
    }

    public boolean isCategorical() {
        return !labels.isEmpty();
    }

    public boolean isNumeric() {
        return labels.isEmpty();
    }

    /**
     * Looks up a parameter by wire key; null when the key is outside the vocabulary.
     */
    public static Parameter fromKey(String key) {
        if (key == null) {
            return null;
        }
        return BY_KEY.get(key.trim());
    }
}
