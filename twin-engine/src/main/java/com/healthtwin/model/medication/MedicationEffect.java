package com.healthtwin.model.medication;

import com.healthtwin.model.enums.ChangeDirection;
import com.healthtwin.util.Decimals;

import java.util.Locale;

/**
 * Predicted change of one parameter under a medication, with confidence in percent.
 */
public record MedicationEffect(
    double before,
    double after,
    String unit,
    ChangeDirection direction,
    double percentageChange,
    int confidence
) {

    public static MedicationEffect predict(double before, double after, String unit,
                                           ChangeDirection direction, int confidence) {
        double percentage = before != 0 ? Decimals.round((after - before) / before * 100, 1) : 0;
        return new MedicationEffect(before, Decimals.round(after, 1), unit, direction, percentage, confidence);
    }

    /**
     * Signed percentage text, e.g. "-30.0%" or "+20.0%".
     */
    public String formattedChange() {
        String sign = percentageChange > 0 ? "+" : "";
        return sign + String.format(Locale.ROOT, "%.1f%%", percentageChange);
    }
}
