package com.healthtwin.model.progression;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.parameter.Parameter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Observed or prescribed parameter changes for one week (1-based).
 */
public record WeeklyRow(int week, Map<Parameter, RowValue> values) {

    public WeeklyRow {
        if (week < 1) {
            throw new InvalidSimulationInputException("Week index must be at least 1: " + week);
        }
        EnumMap<Parameter, RowValue> copy = new EnumMap<>(Parameter.class);
        if (values != null) {
            copy.putAll(values);
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static WeeklyRow of(int week, Map<Parameter, RowValue> values) {
        return new WeeklyRow(week, values);
    }
}
