package com.healthtwin.model.report;

import com.healthtwin.model.enums.HealthCategory;
import com.healthtwin.model.enums.ParameterCategory;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Scored, narrative-free reading of a snapshot.
 *
 * Finding lists are de-duplicated across categories in first-seen order.
 * The breakdown is keyed in scoring order and only holds categories present in the input.
 */
@Value
@Builder
public class Interpretation {

    int overallScore;

    HealthCategory category;

    List<String> riskFactors;

    List<String> alerts;

    List<String> recommendations;

    List<String> strengths;

    Map<ParameterCategory, CategoryScore> breakdown;

    List<String> improvementOpportunities;

    LocalDate nextReviewDate;
}
