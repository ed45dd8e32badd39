package com.healthtwin.model.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Sub-score of one category together with the findings that produced it.
 */
@Value
@Builder
public class CategoryScore {

    int score;

    @Singular
    List<String> riskFactors;

    @Singular
    List<String> recommendations;

    @Singular
    List<String> alerts;

    @Singular
    List<String> strengths;
}
