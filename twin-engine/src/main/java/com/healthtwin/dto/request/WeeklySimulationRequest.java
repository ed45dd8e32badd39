package com.healthtwin.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtwin.model.parameter.ParameterSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for a week-by-week simulation. Weekly data comes either as records keyed by
 * parameter name or as CSV text; records take precedence when both are given.
 */
public record WeeklySimulationRequest(
    @JsonProperty("baseline_parameters")
    ParameterSnapshot baseline,
    @JsonProperty("weekly_records")
    List<Map<String, Object>> weeklyRecords,
    @JsonProperty("weekly_csv")
    String weeklyCsv,
    @JsonProperty("duration_weeks")
    int durationWeeks
) {

    public static WeeklySimulationRequest ofCsv(ParameterSnapshot baseline, String csv, int durationWeeks) {
        return new WeeklySimulationRequest(baseline, null, csv, durationWeeks);
    }

    public static WeeklySimulationRequest ofRecords(ParameterSnapshot baseline, List<Map<String, Object>> records,
                                                    int durationWeeks) {
        return new WeeklySimulationRequest(baseline, records, null, durationWeeks);
    }
}
