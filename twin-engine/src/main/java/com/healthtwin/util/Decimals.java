package com.healthtwin.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and display helpers for clinical values.
 */
public final class Decimals {

    private Decimals() {}

    /**
     * Rounds the exact binary value half-even, so 24.95 stored as 24.9499... rounds down.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static int roundToInt(double value) {
        return (int) round(value, 0);
    }

    /**
     * Renders a value with at most two decimals and no trailing zeros: 142.0 -> "142", 0.30 -> "0.3".
     */
    public static String format(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }
}
