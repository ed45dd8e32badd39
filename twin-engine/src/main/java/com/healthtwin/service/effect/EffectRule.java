package com.healthtwin.service.effect;

import com.healthtwin.model.parameter.Parameter;

import java.util.function.DoublePredicate;

/**
 * Bounded linear effect of an intervention on one parameter.
 *
 * {@code coefficient} is the full effect reached at twelve weeks; {@code cap} bounds the
 * move away from the baseline value. Whole-unit rules truncate the scaled effect.
 */
public record EffectRule(
    Parameter target,
    double coefficient,
    double cap,
    boolean increasing,
    boolean wholeUnits,
    DoublePredicate appliesTo
) {

    private static final DoublePredicate ALWAYS = value -> true;

    public static EffectRule lower(Parameter target, double coefficient, double cap) {
        return new EffectRule(target, coefficient, cap, false, true, ALWAYS);
    }

    public static EffectRule raise(Parameter target, double coefficient, double cap) {
        return new EffectRule(target, coefficient, cap, true, true, ALWAYS);
    }

    /**
     * Fractional decrease applied only when the baseline value exceeds {@code threshold}.
     */
    public static EffectRule lowerAbove(Parameter target, double coefficient, double cap, double threshold) {
        return new EffectRule(target, coefficient, cap, false, false, value -> value > threshold);
    }

    /**
     * Signed change from {@code reference} after the given share of the twelve-week effect.
     */
    public double delta(double reference, double timeFactor) {
        double effect = coefficient * timeFactor;
        if (wholeUnits) {
            effect = Math.floor(effect);
        }
        double target = increasing
            ? Math.min(reference + effect, reference + cap)
            : Math.max(reference - effect, reference - cap);
        return target - reference;
    }
}
