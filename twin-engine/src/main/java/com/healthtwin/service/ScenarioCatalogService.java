package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.RiskLevel;
import com.healthtwin.model.intervention.DietIntervention;
import com.healthtwin.model.intervention.ExerciseIntervention;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.model.intervention.MedicationIntervention;
import com.healthtwin.model.intervention.Scenario;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Predefined simulation scenarios, plus validation of caller-defined ones.
 */
@Service
public class ScenarioCatalogService {

    private static final List<Scenario> PREDEFINED = List.of(
        new Scenario("1", "Cardiovascular Health Optimization",
            "Comprehensive cardiovascular improvement program",
            Intervention.none()
                .withExercise(new ExerciseIntervention("aerobic", "moderate", 45, 5))
                .withDiet(new DietIntervention("mediterranean"))
                .withLifestyle(orderedMap(
                    "stress_management", "daily_meditation",
                    "sleep_optimization", "consistent_schedule")),
            12,
            List.of(
                "Blood pressure reduction: 8-15 mmHg systolic",
                "LDL cholesterol reduction: 15-25%",
                "HDL cholesterol increase: 8-15%",
                "Improved cardiovascular fitness",
                "Better stress management"),
            RiskLevel.LOW, false),
        new Scenario("2", "Metabolic Syndrome Management",
            "Comprehensive approach to metabolic health",
            Intervention.none()
                .withDiet(new DietIntervention("low_carb"))
                .withExercise(new ExerciseIntervention("strength_training", "moderate", 30, 4))
                .withMedication(new MedicationIntervention("metformin", "standard", "twice_daily")),
            16,
            List.of(
                "Fasting glucose reduction: 15-25 mg/dL",
                "HbA1c reduction: 0.5-1.2%",
                "Weight reduction: 5-10%",
                "Improved insulin sensitivity",
                "Better lipid profile"),
            RiskLevel.MEDIUM, false),
        new Scenario("3", "Anti-Aging & Longevity",
            "Comprehensive wellness optimization program",
            Intervention.none()
                .withDiet(new DietIntervention("calorie_restriction"))
                .withExercise(new ExerciseIntervention("mixed", "varied", 60, 6))
                .withLifestyle(orderedMap(
                    "sleep_optimization", "optimal_duration",
                    "stress_management", "comprehensive",
                    "social_connection", "enhanced"))
                .withSupplements(orderedMap(
                    "vitamin_d", "2000_IU",
                    "omega3", "2000_mg",
                    "antioxidants", "comprehensive")),
            24,
            List.of(
                "Improved cellular health markers",
                "Enhanced cognitive function",
                "Better sleep quality",
                "Reduced inflammation markers",
                "Improved energy levels",
                "Enhanced immune function"),
            RiskLevel.LOW, false)
    );

    public List<Scenario> getPredefinedScenarios() {
        return PREDEFINED;
    }

    public Optional<Scenario> findById(String id) {
        return PREDEFINED.stream().filter(scenario -> scenario.id().equals(id)).findFirst();
    }

    /**
     * Builds a caller-defined scenario. Identifiers of custom scenarios are assigned by
     * whoever stores them, so the id is left null here.
     */
    public Scenario createCustom(String name, String description, Intervention interventions,
                                 int durationWeeks, List<String> expectedOutcomes, RiskLevel riskLevel) {
        if (name == null || name.isBlank()) {
            throw new InvalidSimulationInputException("Scenario name is required");
        }
        if (interventions == null || interventions.isEmpty()) {
            throw new InvalidSimulationInputException("Scenario must describe at least one intervention");
        }
        if (durationWeeks < 1) {
            throw new InvalidSimulationInputException("Scenario duration must be at least one week: " + durationWeeks);
        }
        return new Scenario(null, name, description, interventions, durationWeeks,
            expectedOutcomes != null ? List.copyOf(expectedOutcomes) : List.of(),
            riskLevel != null ? riskLevel : RiskLevel.MEDIUM, true);
    }

    private static Map<String, Object> orderedMap(String... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
