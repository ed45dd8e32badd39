package com.healthtwin.model.progression;

import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterChange;
import com.healthtwin.model.parameter.ParameterSnapshot;

import java.util.Map;

/**
 * State of the twin at the end of one simulated week.
 */
public record WeekResult(
    int week,
    ParameterSnapshot parameters,
    Map<Parameter, ParameterChange> changesFromBaseline
) {}
