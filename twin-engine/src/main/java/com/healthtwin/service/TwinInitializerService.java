package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.parameter.DemographicProfile;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates the starting state of a digital twin: a generated baseline, overlaid with any
 * measured values the caller already has. Height, weight and BMI always come from the profile.
 */
@Slf4j
@Service
public class TwinInitializerService {

    private final BaselineGeneratorService baselineGeneratorService;

    public TwinInitializerService(BaselineGeneratorService baselineGeneratorService) {
        this.baselineGeneratorService = baselineGeneratorService;
    }

    public ParameterSnapshot initialize(DemographicProfile profile, ParameterSnapshot measured) {
        if (profile == null) {
            throw new InvalidSimulationInputException("Demographic profile is required");
        }
        ParameterSnapshot generated = baselineGeneratorService.generate(profile);
        if (measured == null || measured.asMap().isEmpty()) {
            return generated;
        }

        ParameterSnapshot.Builder builder = generated.toBuilder();
        measured.asMap().forEach((parameter, value) -> {
            if (value != null) {
                builder.set(parameter, value);
            }
        });

        if (profile.hasBodyMeasurements()) {
            builder.set(Parameter.HEIGHT_CM, profile.heightCm());
            builder.set(Parameter.WEIGHT_KG, profile.weightKg());
            builder.set(Parameter.BMI, DerivedMetrics.bmi(profile.weightKg(), profile.heightCm()));
        }

        log.debug("Initialized twin with {} measured values", measured.asMap().size());
        return builder.build();
    }
}
