package com.healthtwin.model.parameter;

import com.healthtwin.util.Decimals;

/**
 * Movement of one numeric parameter away from its baseline value.
 * Relative change is a percentage and is defined as 0 for a zero baseline.
 */
public record ParameterChange(
    double baseline,
    double current,
    double absoluteChange,
    double relativeChange
) {

    public static ParameterChange between(double baseline, double current) {
        double absolute = current - baseline;
        double relative = baseline != 0 ? absolute / baseline * 100 : 0;
        return new ParameterChange(baseline, current, Decimals.round(absolute, 2), Decimals.round(relative, 1));
    }
}
