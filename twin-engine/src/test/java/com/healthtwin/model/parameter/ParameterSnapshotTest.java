package com.healthtwin.model.parameter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthtwin.dto.request.SimulationRequest;
import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.Gender;
import com.healthtwin.model.enums.ParameterCategory;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.service.DerivedMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ParameterSnapshotTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsNestedJson_andIgnoresUnknownNames() throws Exception {
        String json = """
            {
              "vitals": {"heart_rate": 72, "blood_pressure_systolic": 118.5, "pulse_pressure": 40},
              "lifestyle": {"smoking_status": "former"},
              "genetics": {"apoe": "e4"}
            }
            """;

        ParameterSnapshot snapshot = objectMapper.readValue(json, ParameterSnapshot.class);

        assertThat(snapshot.asMap()).containsOnlyKeys(
            Parameter.HEART_RATE, Parameter.BLOOD_PRESSURE_SYSTOLIC, Parameter.SMOKING_STATUS);
        assertThat(snapshot.number(Parameter.HEART_RATE)).isEqualTo(72.0);
        assertThat(snapshot.label(Parameter.SMOKING_STATUS)).isEqualTo("former");
    }

    @Test
    void writesNestedCategoryView() throws Exception {
        ParameterSnapshot snapshot = ParameterSnapshot.builder()
            .set(Parameter.LDL, 120)
            .set(Parameter.HEART_RATE, 64)
            .build();

        assertThat(objectMapper.writeValueAsString(snapshot))
            .isEqualTo("{\"vitals\":{\"heart_rate\":64.0},\"lipids\":{\"ldl\":120.0}}");
    }

    @Test
    void skipsFieldsFiledUnderAnotherCategory() throws Exception {
        String json = """
            {"vitals": {"ldl": 190, "heart_rate": 70}}
            """;

        ParameterSnapshot snapshot = objectMapper.readValue(json, ParameterSnapshot.class);

        assertThat(snapshot.asMap()).containsOnlyKeys(Parameter.HEART_RATE);
        assertThat(snapshot.hasCategory(ParameterCategory.LIPIDS)).isFalse();
    }

    @Test
    void demographicsSurviveJsonRoundTrip() throws Exception {
        ParameterSnapshot snapshot = ParameterSnapshot.builder()
            .set(Parameter.CREATININE, 1.0)
            .set(Parameter.SMOKING_STATUS, "never")
            .demographics(new DemographicProfile(45, Gender.FEMALE, List.of("diabetes"), 165.0, 62.0))
            .build();

        String json = objectMapper.writeValueAsString(snapshot);
        ParameterSnapshot restored = objectMapper.readValue(json, ParameterSnapshot.class);

        assertThat(json).contains("\"demographics\":{").contains("\"gender\":\"F\"");
        assertThat(restored).isEqualTo(snapshot);
        assertThat(DerivedMetrics.egfr(restored)).isEqualTo(60.0);
    }

    @Test
    void simulationRequestBaseline_carriesDemographicsForEgfr() throws Exception {
        String json = """
            {"baseline_parameters": {
                "metabolic": {"creatinine": 1.0},
                "demographics": {"age": 45, "gender": "female", "medical_conditions": ["hypertension"]}
             },
             "intervention": {"exercise": {"intensity": "moderate"}},
             "duration_weeks": 12}
            """;

        SimulationRequest request = objectMapper.readValue(json, SimulationRequest.class);

        DemographicProfile demographics = request.baseline().getDemographics();
        assertThat(demographics.age()).isEqualTo(45);
        assertThat(demographics.gender()).isEqualTo(Gender.FEMALE);
        assertThat(demographics.hasCondition("hypertension")).isTrue();
        assertThat(DerivedMetrics.egfr(request.baseline())).isEqualTo(60.0);
    }

    @Test
    void invalidDemographicsBlock_isRejected() {
        assertThatThrownBy(() -> ParameterSnapshot.fromNestedMap(
                Map.of("demographics", Map.of("age", 45, "gender", "unknown"))))
            .isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> ParameterSnapshot.fromNestedMap(
                Map.of("demographics", Map.of("gender", "M"))))
            .isInstanceOf(InvalidSimulationInputException.class)
            .hasMessageContaining("Age is required");
    }

    @Test
    void valueKindMustMatchParameter() {
        ParameterSnapshot.Builder builder = ParameterSnapshot.builder();

        assertThatThrownBy(() -> builder.set(Parameter.HEART_RATE, "fast"))
            .isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> builder.set(Parameter.SMOKING_STATUS, 1))
            .isInstanceOf(InvalidSimulationInputException.class);
    }

    @Test
    void transformationsReturnNewSnapshots() {
        ParameterSnapshot original = ParameterSnapshot.builder().set(Parameter.HDL, 50).build();

        ParameterSnapshot changed = original.with(Parameter.HDL, 55);

        assertThat(original.number(Parameter.HDL)).isEqualTo(50.0);
        assertThat(changed.number(Parameter.HDL)).isEqualTo(55.0);
        assertThat(original.category(ParameterCategory.LIPIDS)).containsExactly(Map.entry(Parameter.HDL, 50.0));
    }

    @Test
    void readsInterventionDescriptorWithSnakeCaseFields() throws Exception {
        String json = """
            {"exercise": {"type": "aerobic", "intensity": "vigorous", "duration_minutes": 45, "frequency_per_week": 5},
             "medication": {"name": "Lisinopril", "dose": "10mg"},
             "acupuncture": {"sessions": 4}}
            """;

        Intervention intervention = objectMapper.readValue(json, Intervention.class);

        assertThat(intervention.exercise().durationMinutes()).isEqualTo(45);
        assertThat(intervention.exercise().isCardioEffective()).isTrue();
        assertThat(intervention.medication().normalizedName()).isEqualTo("lisinopril");
        assertThat(intervention.diet()).isNull();
    }
}
