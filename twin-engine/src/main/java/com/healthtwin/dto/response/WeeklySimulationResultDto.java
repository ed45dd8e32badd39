package com.healthtwin.dto.response;

import com.healthtwin.model.report.ScoredReport;

import java.util.List;

/**
 * Response DTO for a week-by-week simulation.
 */
public record WeeklySimulationResultDto(
    List<WeekReportDto> weeklyProgression,
    ScoredReport baselineReport,
    ScoredReport finalReport,
    List<String> improvements,
    List<String> recommendations,
    String narration,
    int durationWeeks
) {}
