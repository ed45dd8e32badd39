package com.healthtwin.dto.response;

import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterChange;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.report.ScoredReport;

import java.util.Map;

/**
 * One week of a weekly simulation with its lab report.
 */
public record WeekReportDto(
    int week,
    ParameterSnapshot parameters,
    ScoredReport labReport,
    Map<Parameter, ParameterChange> changesFromBaseline
) {}
