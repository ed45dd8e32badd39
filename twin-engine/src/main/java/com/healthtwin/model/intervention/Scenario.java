package com.healthtwin.model.intervention;

import com.healthtwin.model.enums.RiskLevel;

import java.util.List;

/**
 * Predefined simulation scenario.
 */
public record Scenario(
    String id,
    String name,
    String description,
    Intervention interventions,
    int durationWeeks,
    List<String> expectedOutcomes,
    RiskLevel riskLevel,
    boolean custom
) {}
