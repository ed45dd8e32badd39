package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.Gender;
import com.healthtwin.model.parameter.DemographicProfile;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.*;

class BaselineGeneratorServiceTest {

    private BaselineGeneratorService service;

    @BeforeEach
    void setUp() {
        service = new BaselineGeneratorService(() -> new SplittableRandom(42));
    }

    @Test
    void sameSeed_producesSameBaseline() {
        DemographicProfile profile = DemographicProfile.of(50, Gender.MALE, List.of("diabetes"));

        assertThat(service.generate(profile)).isEqualTo(service.generate(profile));
    }

    @Test
    void everyScoredCategoryIsFilled_andValuesStayInDrawIntervals() {
        for (long seed = 0; seed < 50; seed++) {
            ParameterSnapshot baseline = service.generate(
                DemographicProfile.of(40, Gender.FEMALE, List.of()), new SplittableRandom(seed));

            assertThat(baseline.number(Parameter.HEART_RATE)).isBetween(60.0, 100.0);
            assertThat(baseline.number(Parameter.BLOOD_PRESSURE_SYSTOLIC)).isBetween(110.0, 140.0);
            assertThat(baseline.number(Parameter.HEMOGLOBIN)).isBetween(12.0, 16.0);
            assertThat(baseline.number(Parameter.HDL)).isBetween(50.0, 70.0);
            assertThat(baseline.number(Parameter.HBA1C)).isBetween(4.0, 5.7);
            assertThat(baseline.number(Parameter.SLEEP_DURATION)).isBetween(6.0, 9.0);
            assertThat(baseline.label(Parameter.SMOKING_STATUS)).isIn("never", "former", "current");
            assertThat(baseline.label(Parameter.ALCOHOL_CONSUMPTION)).isIn("none", "moderate", "heavy");
            assertThat(baseline.has(Parameter.BMI)).isFalse();
        }
    }

    @Test
    void integerFieldsAreWholeNumbers_andDecimalsAreRounded() {
        ParameterSnapshot baseline = service.generate(DemographicProfile.of(30, Gender.MALE, List.of()));

        assertThat(baseline.number(Parameter.PLATELETS) % 1).isZero();
        assertThat(BigDecimal.valueOf(baseline.number(Parameter.TSH)).scale()).isLessThanOrEqualTo(2);
        assertThat(BigDecimal.valueOf(baseline.number(Parameter.BODY_TEMPERATURE)).scale()).isLessThanOrEqualTo(1);
    }

    @Test
    void conditionTags_redrawAffectedFields() {
        DemographicProfile profile = DemographicProfile.of(60, Gender.MALE,
            List.of("diabetes", "hypertension", "cardiovascular_disease", "kidney_disease"));

        for (long seed = 0; seed < 20; seed++) {
            ParameterSnapshot baseline = service.generate(profile, new SplittableRandom(seed));

            assertThat(baseline.number(Parameter.GLUCOSE_FASTING)).isBetween(126.0, 200.0);
            assertThat(baseline.number(Parameter.HBA1C)).isBetween(6.5, 9.0);
            assertThat(baseline.number(Parameter.BLOOD_PRESSURE_SYSTOLIC)).isBetween(140.0, 180.0);
            assertThat(baseline.number(Parameter.LDL)).isBetween(100.0, 160.0);
            assertThat(baseline.number(Parameter.CREATININE)).isBetween(1.3, 3.0);
            assertThat(baseline.number(Parameter.BUN)).isBetween(20.0, 40.0);
        }
    }

    @Test
    void conditionTagsAreCaseSensitive() {
        DemographicProfile profile = DemographicProfile.of(60, Gender.MALE, List.of("Diabetes"));

        for (long seed = 0; seed < 20; seed++) {
            assertThat(service.generate(profile, new SplittableRandom(seed)).number(Parameter.GLUCOSE_FASTING))
                .isBetween(70.0, 100.0);
        }
    }

    @Test
    void bodyMeasurements_fillPhysicalBlock_andDemographicsAreAttached() {
        DemographicProfile profile = new DemographicProfile(45, Gender.FEMALE, List.of(), 170.0, 72.0);

        ParameterSnapshot baseline = service.generate(profile);

        assertThat(baseline.number(Parameter.HEIGHT_CM)).isEqualTo(170.0);
        assertThat(baseline.number(Parameter.WEIGHT_KG)).isEqualTo(72.0);
        assertThat(baseline.number(Parameter.BMI)).isEqualTo(24.9);
        assertThat(baseline.getDemographics()).isEqualTo(profile);
    }

    @Test
    void invalidDemographics_areRejected() {
        assertThatThrownBy(() -> DemographicProfile.of(-1, Gender.MALE, List.of()))
            .isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> DemographicProfile.of(40, null, List.of()))
            .isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> service.generate(null))
            .isInstanceOf(InvalidSimulationInputException.class);
    }
}
