package com.healthtwin.service;

import com.healthtwin.config.EngineConfig;
import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.Gender;
import com.healthtwin.model.parameter.DemographicProfile;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.util.Decimals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

import static com.healthtwin.model.parameter.Parameter.*;

/**
 * Baseline Generator Service
 *
 * Produces a randomized starting snapshot for a patient:
 * 1. Every field is drawn uniformly from its healthy interval (integers inclusive).
 * 2. Hemoglobin, red blood cells and HDL use gender-specific intervals.
 * 3. Condition modifiers then redraw the affected fields from a worse-skewed interval,
 *    in table order; a later modifier wins where two touch the same field.
 * 4. Height and weight, when supplied, fill the physical block including BMI.
 *
 * This is the only source of randomness in the engine.
 */
@Slf4j
@Service
public class BaselineGeneratorService {

    private static final List<Draw> BASE_DRAWS = List.of(
        // Vital signs
        Draw.whole(HEART_RATE, 60, 100),
        Draw.whole(BLOOD_PRESSURE_SYSTOLIC, 110, 140),
        Draw.whole(BLOOD_PRESSURE_DIASTOLIC, 70, 90),
        Draw.whole(RESPIRATORY_RATE, 12, 20),
        Draw.decimal(BODY_TEMPERATURE, 36.5, 37.5, 1),
        Draw.whole(OXYGEN_SATURATION, 95, 99),

        // Complete blood count (hemoglobin and red cells are gender-specific)
        Draw.decimal(WHITE_BLOOD_CELLS, 4.0, 11.0, 1),
        Draw.whole(PLATELETS, 150, 450),

        // Metabolic panel
        Draw.whole(GLUCOSE_FASTING, 70, 100),
        Draw.whole(GLUCOSE_RANDOM, 70, 140),
        Draw.decimal(HBA1C, 4.0, 5.7, 1),
        Draw.decimal(CREATININE, 0.6, 1.2, 2),
        Draw.whole(BUN, 7, 20),
        Draw.whole(SODIUM, 135, 145),
        Draw.decimal(POTASSIUM, 3.5, 5.0, 1),
        Draw.whole(CHLORIDE, 96, 106),
        Draw.whole(BICARBONATE, 22, 28),

        // Lipid profile (HDL is gender-specific)
        Draw.whole(TOTAL_CHOLESTEROL, 150, 200),
        Draw.whole(LDL, 70, 130),
        Draw.whole(TRIGLYCERIDES, 50, 150),

        // Liver function
        Draw.whole(ALT, 7, 55),
        Draw.whole(AST, 8, 48),
        Draw.decimal(BILIRUBIN, 0.3, 1.2, 1),
        Draw.decimal(ALBUMIN, 3.4, 5.4, 1),

        // Thyroid function
        Draw.decimal(TSH, 0.4, 4.0, 2),
        Draw.decimal(T3, 2.3, 4.2, 1),
        Draw.decimal(T4, 0.8, 1.8, 1),

        // Lifestyle
        Draw.whole(DIET_CARBS_PERCENT, 40, 60),
        Draw.whole(DIET_FATS_PERCENT, 20, 35),
        Draw.whole(DIET_PROTEIN_PERCENT, 15, 25),
        Draw.whole(CALORIE_INTAKE, 1800, 2500),
        Draw.whole(EXERCISE_FREQUENCY, 0, 7),
        Draw.whole(EXERCISE_DURATION, 0, 60),
        Draw.decimal(SLEEP_DURATION, 6.0, 9.0, 1),
        Draw.whole(SLEEP_QUALITY, 1, 10),
        Draw.whole(STRESS_LEVEL, 1, 10)
    );

    private static final List<Draw> FEMALE_DRAWS = List.of(
        Draw.decimal(HEMOGLOBIN, 12.0, 16.0, 1),
        Draw.decimal(RED_BLOOD_CELLS, 4.0, 5.5, 2),
        Draw.whole(HDL, 50, 70)
    );

    private static final List<Draw> MALE_DRAWS = List.of(
        Draw.decimal(HEMOGLOBIN, 14.0, 18.0, 1),
        Draw.decimal(RED_BLOOD_CELLS, 4.5, 6.0, 2),
        Draw.whole(HDL, 40, 60)
    );

    private static final List<ConditionModifier> CONDITION_MODIFIERS = List.of(
        new ConditionModifier("diabetes", List.of(
            Draw.whole(GLUCOSE_FASTING, 126, 200),
            Draw.whole(GLUCOSE_RANDOM, 200, 300),
            Draw.decimal(HBA1C, 6.5, 9.0, 1)
        )),
        new ConditionModifier("hypertension", List.of(
            Draw.whole(BLOOD_PRESSURE_SYSTOLIC, 140, 180),
            Draw.whole(BLOOD_PRESSURE_DIASTOLIC, 90, 110)
        )),
        new ConditionModifier("cardiovascular_disease", List.of(
            Draw.whole(HEART_RATE, 70, 110),
            Draw.whole(LDL, 100, 160)
        )),
        new ConditionModifier("kidney_disease", List.of(
            Draw.decimal(CREATININE, 1.3, 3.0, 2),
            Draw.whole(BUN, 20, 40)
        ))
    );

    private final Supplier<RandomGenerator> randomSource;

    public BaselineGeneratorService(@Qualifier(EngineConfig.BASELINE_RANDOM_SOURCE) Supplier<RandomGenerator> randomSource) {
        this.randomSource = randomSource;
    }

    /**
     * Generates a baseline with the configured random source.
     */
    public ParameterSnapshot generate(DemographicProfile profile) {
        return generate(profile, randomSource.get());
    }

    /**
     * Generates a baseline drawing from the given random source. Results are reproducible
     * for a seeded generator.
     */
    public ParameterSnapshot generate(DemographicProfile profile, RandomGenerator random) {
        if (profile == null) {
            throw new InvalidSimulationInputException("Demographic profile is required");
        }
        if (random == null) {
            throw new InvalidSimulationInputException("Random source is required");
        }

        ParameterSnapshot.Builder builder = ParameterSnapshot.builder().demographics(profile);

        applyDraws(builder, BASE_DRAWS, random);
        applyDraws(builder, profile.gender() == Gender.FEMALE ? FEMALE_DRAWS : MALE_DRAWS, random);
        builder.set(SMOKING_STATUS, pick(SMOKING_STATUS, random));
        builder.set(ALCOHOL_CONSUMPTION, pick(ALCOHOL_CONSUMPTION, random));

        for (ConditionModifier modifier : CONDITION_MODIFIERS) {
            if (profile.hasCondition(modifier.tag())) {
                applyDraws(builder, modifier.draws(), random);
            }
        }

        if (profile.hasBodyMeasurements()) {
            builder.set(HEIGHT_CM, profile.heightCm());
            builder.set(WEIGHT_KG, profile.weightKg());
            builder.set(BMI, DerivedMetrics.bmi(profile.weightKg(), profile.heightCm()));
        }

        log.debug("Generated baseline for age {} gender {} conditions {}",
            profile.age(), profile.gender(), profile.conditions());
        return builder.build();
    }

    private void applyDraws(ParameterSnapshot.Builder builder, List<Draw> draws, RandomGenerator random) {
        for (Draw draw : draws) {
            builder.set(draw.parameter(), draw.sample(random));
        }
    }

    private String pick(Parameter parameter, RandomGenerator random) {
        List<String> labels = parameter.getLabels();
        return labels.get(random.nextInt(labels.size()));
    }

    /**
     * Uniform draw over [min, max]; decimals of zero means an inclusive integer draw.
     */
    record Draw(Parameter parameter, double min, double max, int decimals) {

        static Draw whole(Parameter parameter, int min, int max) {
            return new Draw(parameter, min, max, 0);
        }

        static Draw decimal(Parameter parameter, double min, double max, int decimals) {
            return new Draw(parameter, min, max, decimals);
        }

        double sample(RandomGenerator random) {
            if (decimals == 0) {
                return random.nextInt((int) min, (int) max + 1);
            }
            return Decimals.round(random.nextDouble(min, max), decimals);
        }
    }

    record ConditionModifier(String tag, List<Draw> draws) {}
}
