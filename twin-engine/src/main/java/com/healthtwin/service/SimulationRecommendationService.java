package com.healthtwin.service;

import com.healthtwin.model.intervention.Intervention;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed follow-up advice for a simulation, per intervention kind present,
 * always closed by the general lines.
 */
@Service
public class SimulationRecommendationService {

    static final List<String> EXERCISE = List.of(
        "Continue with the prescribed exercise program for optimal results",
        "Monitor heart rate and blood pressure during exercise",
        "Gradually increase intensity as fitness improves");

    static final List<String> DIET = List.of(
        "Maintain the dietary changes consistently",
        "Monitor portion sizes and meal timing",
        "Stay hydrated throughout the day");

    static final List<String> MEDICATION = List.of(
        "Take medications as prescribed",
        "Monitor for any side effects",
        "Regular follow-up with healthcare provider");

    static final List<String> LIFESTYLE = List.of(
        "Maintain consistent sleep schedule",
        "Practice stress management techniques regularly",
        "Stay socially connected and engaged");

    static final List<String> GENERAL = List.of(
        "Schedule regular health check-ups",
        "Track progress and maintain a health journal",
        "Celebrate improvements and stay motivated");

    public List<String> recommend(Intervention intervention) {
        List<String> recommendations = new ArrayList<>();
        if (intervention != null) {
            if (intervention.exercise() != null) recommendations.addAll(EXERCISE);
            if (intervention.diet() != null) recommendations.addAll(DIET);
            if (intervention.medication() != null) recommendations.addAll(MEDICATION);
            if (intervention.lifestyle() != null) recommendations.addAll(LIFESTYLE);
        }
        recommendations.addAll(GENERAL);
        return recommendations;
    }

    /**
     * Advice for a progression driven by observed weekly data, where no intervention kind is known.
     */
    public List<String> recommendForObservedData() {
        return GENERAL;
    }
}
