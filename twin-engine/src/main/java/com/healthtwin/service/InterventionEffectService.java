package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.intervention.Intervention;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.service.effect.EffectRule;
import com.healthtwin.service.effect.EffectRules;
import com.healthtwin.util.Decimals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Intervention Effect Service
 *
 * Projects a baseline forward under an intervention:
 * - time factor = min(weeks / 12, 1), so the full effect is reached at twelve weeks
 * - kinds are applied in the order exercise, diet, medication, sleep
 * - every rule computes its change against the original baseline value and the changes
 *   of different kinds add up on the same field
 *
 * Fields missing from the baseline are left alone.
 */
@Slf4j
@Service
public class InterventionEffectService {

    static final double FULL_EFFECT_WEEKS = 12.0;

    public ParameterSnapshot project(ParameterSnapshot baseline, Intervention intervention, int durationWeeks) {
        if (baseline == null) {
            throw new InvalidSimulationInputException("Baseline parameters are required");
        }
        if (durationWeeks < 0) {
            throw new InvalidSimulationInputException("Duration must not be negative: " + durationWeeks);
        }
        if (intervention == null || durationWeeks == 0) {
            return baseline;
        }

        double timeFactor = timeFactor(durationWeeks);
        Map<Parameter, Double> deltas = new EnumMap<>(Parameter.class);
        for (EffectRule rule : rulesFor(intervention)) {
            Double reference = baseline.number(rule.target());
            if (reference == null || !rule.appliesTo().test(reference)) {
                continue;
            }
            deltas.merge(rule.target(), rule.delta(reference, timeFactor), Double::sum);
        }

        if (deltas.isEmpty()) {
            return baseline;
        }

        ParameterSnapshot.Builder projected = baseline.toBuilder();
        deltas.forEach((parameter, delta) ->
            projected.set(parameter, Decimals.round(baseline.number(parameter) + delta, 2)));

        log.debug("Projected {} parameters over {} weeks", deltas.size(), durationWeeks);
        return DerivedMetrics.refreshBmi(baseline, projected.build());
    }

    static double timeFactor(int durationWeeks) {
        return Math.min(durationWeeks / FULL_EFFECT_WEEKS, 1.0);
    }

    /**
     * Rules of every present kind, in application order.
     */
    List<EffectRule> rulesFor(Intervention intervention) {
        List<EffectRule> rules = new ArrayList<>();
        if (intervention.exercise() != null) {
            rules.addAll(EffectRules.forExercise(intervention.exercise()));
        }
        if (intervention.diet() != null) {
            rules.addAll(EffectRules.forDiet(intervention.diet()));
        }
        if (intervention.medication() != null) {
            rules.addAll(EffectRules.forMedication(intervention.medication()));
        }
        if (intervention.sleep() != null) {
            rules.addAll(EffectRules.forSleep(intervention.sleep()));
        }
        return rules;
    }
}
