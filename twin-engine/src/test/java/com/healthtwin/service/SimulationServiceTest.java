package com.healthtwin.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthtwin.dto.request.SimulationRequest;
import com.healthtwin.dto.request.WeeklySimulationRequest;
import com.healthtwin.dto.response.SimulationResultDto;
import com.healthtwin.dto.response.WeeklySimulationResultDto;
import com.healthtwin.model.enums.ParameterCategory;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.service.narration.NarrationClient;
import com.healthtwin.service.narration.NarrationPromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class SimulationServiceTest {

    private NarrationClient narrationClient;
    private ParameterSnapshot baseline;

    @BeforeEach
    void setUp() {
        narrationClient = mock(NarrationClient.class);
        baseline = ParameterSnapshot.builder()
            .set(Parameter.BLOOD_PRESSURE_SYSTOLIC, 150)
            .set(Parameter.BLOOD_PRESSURE_DIASTOLIC, 95)
            .set(Parameter.HEIGHT_CM, 170)
            .set(Parameter.WEIGHT_KG, 70)
            .build();
    }

    private SimulationService service(Optional<NarrationClient> client, boolean enabled) {
        Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);
        return new SimulationService(
            new InterventionEffectService(),
            new WeeklyProgressionService(),
            new WeeklyRowParser(),
            new ReportBuilderService(new HealthScoringService(clock), clock),
            new ComparisonService(),
            new SimulationRecommendationService(),
            new NarrationPromptBuilder(new ObjectMapper()),
            client,
            enabled);
    }

    @Test
    void projection_comparesReportsAndNarrates() throws Exception {
        when(narrationClient.narrate(anyString())).thenReturn("Looks promising");

        SimulationResultDto result = service(Optional.of(narrationClient), true)
            .runSimulation(new SimulationRequest(baseline, Intervention.exercise("moderate"), 12));

        assertThat(result.projectedParameters().number(Parameter.BLOOD_PRESSURE_SYSTOLIC)).isEqualTo(142.0);
        assertThat(result.improvements()).containsExactly(
            "Blood pressure reduced by 8 mmHg systolic",
            "Blood pressure reduced by 5 mmHg diastolic");
        assertThat(result.recommendations()).startsWith(
            "Continue with the prescribed exercise program for optimal results");
        assertThat(result.baselineReport().getInterpretation().getRiskFactors())
            .contains("High systolic blood pressure (Stage 1)");
        assertThat(result.projectedReport().section(ParameterCategory.VITALS).get(Parameter.BLOOD_PRESSURE_SYSTOLIC).value())
            .isEqualTo(142.0);
        assertThat(result.narration()).isEqualTo("Looks promising");
        verify(narrationClient).narrate(contains("Simulation Duration: 12 weeks"));
    }

    @Test
    void narrationFailure_fallsBackToMessage() throws Exception {
        when(narrationClient.narrate(anyString())).thenThrow(new IllegalStateException("quota exceeded"));

        SimulationResultDto result = service(Optional.of(narrationClient), true)
            .runSimulation(new SimulationRequest(baseline, Intervention.diet("low_sodium"), 6));

        assertThat(result.narration()).isEqualTo("Unable to generate AI simulation recommendations: quota exceeded");
        assertThat(result.improvements()).isNotEmpty();
    }

    @Test
    void disabledNarration_skipsClient() throws Exception {
        SimulationResultDto result = service(Optional.of(narrationClient), false)
            .runSimulation(new SimulationRequest(baseline, Intervention.none(), 4));

        assertThat(result.narration()).isNull();
        assertThat(result.improvements()).isEmpty();
        verify(narrationClient, never()).narrate(anyString());
    }

    @Test
    void weeklySimulationFromCsv_reportsEveryWeek() throws Exception {
        when(narrationClient.narrate(anyString())).thenThrow(new RuntimeException("offline"));
        String csv = """
            week,weight_kg,blood_pressure_systolic
            2,+2,140
            """;

        WeeklySimulationResultDto result = service(Optional.of(narrationClient), true)
            .runWeeklySimulation(WeeklySimulationRequest.ofCsv(baseline, csv, 3));

        assertThat(result.weeklyProgression()).hasSize(3);
        assertThat(result.weeklyProgression().get(0).parameters()).isEqualTo(baseline);
        assertThat(result.finalReport().getBmi()).isEqualTo(24.9);
        assertThat(result.improvements()).containsExactly("Blood pressure reduced by 10 mmHg systolic");
        assertThat(result.recommendations()).containsExactly(
            "Schedule regular health check-ups",
            "Track progress and maintain a health journal",
            "Celebrate improvements and stay motivated");
        assertThat(result.narration()).isEqualTo("Unable to generate AI progression analysis: offline");
        verify(narrationClient).narrate(contains("Weekly Progression"));
    }

    @Test
    void missingClient_leavesNarrationEmpty() {
        WeeklySimulationResultDto result = service(Optional.empty(), true)
            .runWeeklySimulation(WeeklySimulationRequest.ofCsv(baseline, "week,heart_rate\n1,72\n", 1));

        assertThat(result.narration()).isNull();
        assertThat(result.weeklyProgression().get(0).changesFromBaseline()).doesNotContainKey(Parameter.HEART_RATE);
    }
}
