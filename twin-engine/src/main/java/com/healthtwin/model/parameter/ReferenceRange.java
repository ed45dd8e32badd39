package com.healthtwin.model.parameter;

import com.healthtwin.model.enums.Flag;
import com.healthtwin.util.Decimals;

/**
 * Inclusive normal range for a numeric parameter.
 */
public record ReferenceRange(double min, double max) {

    public ReferenceRange {
        if (min > max) {
            throw new IllegalArgumentException("Reference range min " + min + " exceeds max " + max);
        }
    }

    public static ReferenceRange of(double min, double max) {
        return new ReferenceRange(min, max);
    }

    public Flag flag(double value) {
        if (value < min) return Flag.LOW;
        if (value > max) return Flag.HIGH;
        return Flag.NORMAL;
    }

    public String display() {
        return Decimals.format(min) + "-" + Decimals.format(max);
    }
}
