package com.healthtwin.service;

import com.healthtwin.model.consultation.ConsultationSummary;
import com.healthtwin.model.enums.ConsultationType;
import com.healthtwin.model.parameter.ParameterSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

import static com.healthtwin.model.parameter.Parameter.*;

/**
 * Consultation Service
 *
 * Summarizes a snapshot into risk factors, strengths and immediate actions, and proposes
 * next steps for a consultation focus. Thresholds:
 * - systolic > 140 risk, < 120 strength
 * - fasting glucose > 100 risk, < 90 strength
 * - LDL > 100 risk, otherwise HDL > 50 strength
 * - exercise < 3 days risk, >= 5 strength
 * - sleep < 7 hours risk
 */
@Service
public class ConsultationService {

    public ConsultationSummary summarize(ParameterSnapshot snapshot, ConsultationType consultationType) {
        List<String> riskFactors = new ArrayList<>();
        List<String> strengths = new ArrayList<>();
        List<String> actions = new ArrayList<>();

        Double systolic = snapshot.number(BLOOD_PRESSURE_SYSTOLIC);
        if (systolic != null) {
            if (systolic > 140) {
                riskFactors.add("Elevated systolic blood pressure");
                actions.add("Monitor blood pressure daily");
            } else if (systolic < 120) {
                strengths.add("Normal blood pressure");
            }
        }

        Double glucose = snapshot.number(GLUCOSE_FASTING);
        if (glucose != null) {
            if (glucose > 100) {
                riskFactors.add("Elevated fasting glucose");
                actions.add("Focus on carbohydrate management");
            } else if (glucose < 90) {
                strengths.add("Healthy glucose levels");
            }
        }

        Double ldl = snapshot.number(LDL);
        Double hdl = snapshot.number(HDL);
        if (ldl != null && ldl > 100) {
            riskFactors.add("Elevated LDL cholesterol");
            actions.add("Implement heart-healthy diet");
        } else if (hdl != null && hdl > 50) {
            strengths.add("Good HDL cholesterol");
        }

        Double exercise = snapshot.number(EXERCISE_FREQUENCY);
        if (exercise != null) {
            if (exercise < 3) {
                riskFactors.add("Insufficient physical activity");
                actions.add("Start with 3 days/week exercise");
            } else if (exercise >= 5) {
                strengths.add("Regular exercise routine");
            }
        }

        Double sleep = snapshot.number(SLEEP_DURATION);
        if (sleep != null && sleep < 7) {
            riskFactors.add("Insufficient sleep");
            actions.add("Aim for 7-9 hours sleep");
        }

        return new ConsultationSummary(consultationType, riskFactors, strengths, actions);
    }

    public List<String> nextSteps(ConsultationType consultationType, int healthScore) {
        List<String> steps = new ArrayList<>(stepsFor(consultationType));

        if (healthScore < 50) {
            steps.add("Consider consulting healthcare provider soon");
        } else if (healthScore < 70) {
            steps.add("Focus on high-impact lifestyle changes");
        } else {
            steps.add("Maintain current healthy habits");
        }
        return steps;
    }

    private List<String> stepsFor(ConsultationType consultationType) {
        if (consultationType == null) {
            return List.of();
        }
        return switch (consultationType) {
            case GENERAL -> List.of(
                "Review consultation recommendations",
                "Implement priority lifestyle changes",
                "Schedule follow-up consultation in 2-4 weeks");
            case LIFESTYLE -> List.of(
                "Start with one lifestyle change this week",
                "Track progress in a health journal",
                "Gradually add more changes over time");
            case NUTRITION -> List.of(
                "Plan meals for the upcoming week",
                "Create a shopping list",
                "Start with one dietary change");
            case EXERCISE -> List.of(
                "Begin with light exercise routine",
                "Focus on consistency over intensity",
                "Monitor how your body responds");
            case COMPREHENSIVE -> List.of(
                "Review all recommendations thoroughly",
                "Create a personalized action plan",
                "Set specific, measurable goals",
                "Schedule regular progress reviews");
        };
    }
}
