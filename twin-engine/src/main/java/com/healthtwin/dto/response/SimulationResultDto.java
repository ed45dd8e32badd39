package com.healthtwin.dto.response;

import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.report.ScoredReport;

import java.util.List;

/**
 * Response DTO for an intervention projection.
 */
public record SimulationResultDto(
    ParameterSnapshot projectedParameters,
    ScoredReport baselineReport,
    ScoredReport projectedReport,
    List<String> improvements,
    List<String> recommendations,
    String narration,
    int durationWeeks
) {}
