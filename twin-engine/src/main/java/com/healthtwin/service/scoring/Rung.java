package com.healthtwin.service.scoring;

import com.healthtwin.model.report.Finding;

import java.util.List;
import java.util.function.Predicate;

/**
 * One step of a scoring ladder: when the value matches, the category score moves by
 * {@code adjustment} and the findings are recorded.
 */
public record Rung(Predicate<Object> matches, int adjustment, List<Finding> findings) {

    public Rung {
        findings = List.copyOf(findings);
    }

    public static Rung atMost(double limit, int adjustment, Finding... findings) {
        return numeric(v -> v <= limit, adjustment, findings);
    }

    public static Rung below(double limit, int adjustment, Finding... findings) {
        return numeric(v -> v < limit, adjustment, findings);
    }

    public static Rung above(double limit, int adjustment, Finding... findings) {
        return numeric(v -> v > limit, adjustment, findings);
    }

    public static Rung atLeast(double limit, int adjustment, Finding... findings) {
        return numeric(v -> v >= limit, adjustment, findings);
    }

    /** Inclusive on both ends. */
    public static Rung between(double min, double max, int adjustment, Finding... findings) {
        return numeric(v -> v >= min && v <= max, adjustment, findings);
    }

    /** Inclusive min, exclusive max. */
    public static Rung halfOpen(double min, double max, int adjustment, Finding... findings) {
        return numeric(v -> v >= min && v < max, adjustment, findings);
    }

    public static Rung is(String label, int adjustment, Finding... findings) {
        return new Rung(label::equals, adjustment, List.of(findings));
    }

    /** Matches any numeric value; closes a ladder. */
    public static Rung otherwise(int adjustment, Finding... findings) {
        return numeric(v -> true, adjustment, findings);
    }

    public boolean test(Object value) {
        return value != null && matches.test(value);
    }

    private static Rung numeric(NumericTest test, int adjustment, Finding... findings) {
        return new Rung(value -> value instanceof Double number && test.accept(number), adjustment, List.of(findings));
    }

    @FunctionalInterface
    private interface NumericTest {
        boolean accept(double value);
    }
}
