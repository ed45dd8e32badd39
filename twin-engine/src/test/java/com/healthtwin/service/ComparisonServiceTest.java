package com.healthtwin.service;

import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ComparisonServiceTest {

    private final ComparisonService service = new ComparisonService();

    private final ParameterSnapshot before = ParameterSnapshot.builder()
        .set(Parameter.BLOOD_PRESSURE_SYSTOLIC, 150)
        .set(Parameter.BLOOD_PRESSURE_DIASTOLIC, 95)
        .set(Parameter.GLUCOSE_FASTING, 110)
        .set(Parameter.HBA1C, 6.5)
        .set(Parameter.LDL, 160)
        .set(Parameter.HDL, 45)
        .build();

    @Test
    void comparingASnapshotWithItself_yieldsNothing() {
        assertThat(service.compare(before, before)).isEmpty();
    }

    @Test
    void listsImprovementsInFixedOrder() {
        ParameterSnapshot after = before.toBuilder()
            .set(Parameter.HDL, 50)
            .set(Parameter.BLOOD_PRESSURE_SYSTOLIC, 142)
            .set(Parameter.HBA1C, 6.2)
            .set(Parameter.BLOOD_PRESSURE_DIASTOLIC, 90)
            .build();

        assertThat(service.compare(before, after)).containsExactly(
            "Blood pressure reduced by 8 mmHg systolic",
            "Blood pressure reduced by 5 mmHg diastolic",
            "HbA1c reduced by 0.3%",
            "HDL cholesterol increased by 5 mg/dL");
    }

    @Test
    void worseningAndMissingFields_areNotReported() {
        ParameterSnapshot after = ParameterSnapshot.builder()
            .set(Parameter.BLOOD_PRESSURE_SYSTOLIC, 155)
            .set(Parameter.HDL, 40)
            .set(Parameter.LDL, 150.5)
            .build();

        assertThat(service.compare(before, after)).containsExactly("LDL cholesterol reduced by 9.5 mg/dL");
    }
}
