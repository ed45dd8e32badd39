package com.healthtwin.model.parameter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.Gender;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Demographic context of a modelled patient.
 *
 * Condition tags are matched case-sensitively against the baseline modifier table
 * ("diabetes", "hypertension", "cardiovascular_disease", "kidney_disease").
 * Height and weight are optional; when both are present the baseline carries a physical block.
 */
public record DemographicProfile(
    Integer age,
    Gender gender,
    @JsonProperty("medical_conditions")
    List<String> conditions,
    @JsonProperty("height_cm")
    Double heightCm,
    @JsonProperty("weight_kg")
    Double weightKg
) {

    public DemographicProfile {
        if (age == null) {
            throw new InvalidSimulationInputException("Age is required");
        }
        if (age < 0) {
            throw new InvalidSimulationInputException("Age must not be negative: " + age);
        }
        if (gender == null) {
            throw new InvalidSimulationInputException("Gender is required");
        }
        if (heightCm != null && heightCm <= 0) {
            throw new InvalidSimulationInputException("Height must be positive: " + heightCm);
        }
        if (weightKg != null && weightKg <= 0) {
            throw new InvalidSimulationInputException("Weight must be positive: " + weightKg);
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static DemographicProfile of(int age, Gender gender, List<String> conditions) {
        return new DemographicProfile(age, gender, conditions, null, null);
    }

    /**
     * Reads the demographics block of a snapshot's wire form.
     */
    public static DemographicProfile fromMap(Map<String, ?> fields) {
        if (fields == null) {
            return null;
        }
        Object gender = fields.get("gender");
        Object conditions = fields.get("medical_conditions");
        if (conditions != null && !(conditions instanceof List<?>)) {
            throw new InvalidSimulationInputException("Medical conditions must be a list: " + conditions);
        }
        List<String> tags = new ArrayList<>();
        if (conditions instanceof List<?> list) {
            list.forEach(tag -> tags.add(String.valueOf(tag)));
        }
        Gender parsedGender;
        try {
            parsedGender = gender != null ? Gender.fromValue(gender.toString()) : null;
        } catch (IllegalArgumentException e) {
            throw new InvalidSimulationInputException(e.getMessage(), e);
        }
        Double age = number(fields, "age");
        return new DemographicProfile(
            age != null ? age.intValue() : null,
            parsedGender,
            tags,
            number(fields, "height_cm"),
            number(fields, "weight_kg"));
    }

    public boolean hasCondition(String tag) {
        return conditions.contains(tag);
    }

    public boolean hasBodyMeasurements() {
        return heightCm != null && weightKg != null;
    }

    private static Double number(Map<String, ?> fields, String name) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new InvalidSimulationInputException("Expected a number for " + name + " but got '" + value + "'");
    }
}
