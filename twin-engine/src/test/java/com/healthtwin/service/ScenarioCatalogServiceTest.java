package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.RiskLevel;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.model.intervention.Scenario;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScenarioCatalogServiceTest {

    private final ScenarioCatalogService service = new ScenarioCatalogService();

    @Test
    void offersThreePredefinedScenarios() {
        assertThat(service.getPredefinedScenarios())
            .extracting(Scenario::id, Scenario::durationWeeks, Scenario::riskLevel)
            .containsExactly(
                tuple("1", 12, RiskLevel.LOW),
                tuple("2", 16, RiskLevel.MEDIUM),
                tuple("3", 24, RiskLevel.LOW));
    }

    @Test
    void metabolicScenario_combinesDietExerciseAndMetformin() {
        Scenario scenario = service.findById("2").orElseThrow();

        assertThat(scenario.name()).isEqualTo("Metabolic Syndrome Management");
        assertThat(scenario.interventions().diet().type()).isEqualTo("low_carb");
        assertThat(scenario.interventions().medication().name()).isEqualTo("metformin");
        assertThat(scenario.interventions().exercise().isCardioEffective()).isTrue();
        assertThat(scenario.custom()).isFalse();
    }

    @Test
    void unknownId_isEmpty() {
        assertThat(service.findById("42")).isEmpty();
    }

    @Test
    void customScenario_isValidated() {
        Scenario custom = service.createCustom("Walk more", "Daily walks",
            Intervention.exercise("moderate"), 8, List.of("Lower resting heart rate"), null);

        assertThat(custom.custom()).isTrue();
        assertThat(custom.riskLevel()).isEqualTo(RiskLevel.MEDIUM);

        assertThatThrownBy(() -> service.createCustom("Nothing", null, Intervention.none(), 8, null, RiskLevel.LOW))
            .isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> service.createCustom("Walk", null, Intervention.exercise("moderate"), 0, null, null))
            .isInstanceOf(InvalidSimulationInputException.class);
    }
}
