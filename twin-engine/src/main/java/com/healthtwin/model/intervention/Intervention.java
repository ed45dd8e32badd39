package com.healthtwin.model.intervention;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Intervention descriptor. Any combination of kinds may be present; each kind's
 * effect is computed independently against the baseline.
 *
 * The lifestyle and supplements blocks are free-form. They are not modelled as
 * parameter effects and only shape the generated recommendations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Intervention(
    ExerciseIntervention exercise,
    DietIntervention diet,
    MedicationIntervention medication,
    SleepIntervention sleep,
    Map<String, Object> lifestyle,
    Map<String, Object> supplements
) {

    public static Intervention none() {
        return new Intervention(null, null, null, null, null, null);
    }

    public static Intervention exercise(String intensity) {
        return none().withExercise(ExerciseIntervention.ofIntensity(intensity));
    }

    public static Intervention diet(String type) {
        return none().withDiet(new DietIntervention(type));
    }

    public static Intervention medication(String name) {
        return none().withMedication(MedicationIntervention.named(name));
    }

    public static Intervention sleep(String improvement) {
        return none().withSleep(new SleepIntervention(improvement));
    }

    public Intervention withExercise(ExerciseIntervention value) {
        return new Intervention(value, diet, medication, sleep, lifestyle, supplements);
    }

    public Intervention withDiet(DietIntervention value) {
        return new Intervention(exercise, value, medication, sleep, lifestyle, supplements);
    }

    public Intervention withMedication(MedicationIntervention value) {
        return new Intervention(exercise, diet, value, sleep, lifestyle, supplements);
    }

    public Intervention withSleep(SleepIntervention value) {
        return new Intervention(exercise, diet, medication, value, lifestyle, supplements);
    }

    public Intervention withLifestyle(Map<String, Object> value) {
        return new Intervention(exercise, diet, medication, sleep, value, supplements);
    }

    public Intervention withSupplements(Map<String, Object> value) {
        return new Intervention(exercise, diet, medication, sleep, lifestyle, value);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return exercise == null && diet == null && medication == null && sleep == null
            && lifestyle == null && supplements == null;
    }
}
