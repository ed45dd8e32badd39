package com.healthtwin.service;

import com.healthtwin.model.enums.FindingType;
import com.healthtwin.model.enums.HealthCategory;
import com.healthtwin.model.enums.ParameterCategory;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.report.CategoryScore;
import com.healthtwin.model.report.Finding;
import com.healthtwin.model.report.Interpretation;
import com.healthtwin.service.scoring.FieldLadder;
import com.healthtwin.service.scoring.Rung;
import com.healthtwin.service.scoring.ScoringLadders;
import com.healthtwin.util.Decimals;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Health Scoring Service
 *
 * Scores a snapshot category by category and combines the results:
 * - Each present category starts at 100 and walks its threshold ladders
 * - Sub-scores are clamped to 0-100
 * - Overall = weighted mean over the categories present
 *     vitals 0.25, metabolic 0.25, lipids 0.20, lifestyle 0.20,
 *     cbc 0.05, liver 0.03, thyroid 0.02
 *
 * Review interval: Excellent 180 days, Good 90, Fair 30, otherwise 7.
 */
@Service
public class HealthScoringService {

    static final int FULL_SCORE = 100;
    static final int OPPORTUNITY_THRESHOLD = 80;

    private final Clock clock;

    public HealthScoringService(Clock clock) {
        this.clock = clock;
    }

    public Interpretation score(ParameterSnapshot snapshot) {
        Map<ParameterCategory, CategoryScore> breakdown = new LinkedHashMap<>();
        ScoringLadders.inScoringOrder().forEach((category, ladders) -> {
            if (snapshot.hasCategory(category)) {
                breakdown.put(category, scoreCategory(snapshot, ladders));
            }
        });

        int overall = overallScore(breakdown);

        Set<String> riskFactors = new LinkedHashSet<>();
        Set<String> alerts = new LinkedHashSet<>();
        Set<String> recommendations = new LinkedHashSet<>();
        Set<String> strengths = new LinkedHashSet<>();
        for (CategoryScore categoryScore : breakdown.values()) {
            riskFactors.addAll(categoryScore.getRiskFactors());
            alerts.addAll(categoryScore.getAlerts());
            recommendations.addAll(categoryScore.getRecommendations());
            strengths.addAll(categoryScore.getStrengths());
        }

        return Interpretation.builder()
            .overallScore(overall)
            .category(HealthCategory.fromScore(overall))
            .riskFactors(List.copyOf(riskFactors))
            .alerts(List.copyOf(alerts))
            .recommendations(List.copyOf(recommendations))
            .strengths(List.copyOf(strengths))
            .breakdown(Collections.unmodifiableMap(breakdown))
            .improvementOpportunities(improvementOpportunities(breakdown, overall))
            .nextReviewDate(nextReviewDate(overall))
            .build();
    }

    /**
     * Scores one category's fields against their ladders.
     */
    CategoryScore scoreCategory(ParameterSnapshot snapshot, List<FieldLadder> ladders) {
        int score = FULL_SCORE;
        CategoryScore.CategoryScoreBuilder builder = CategoryScore.builder();

        for (FieldLadder ladder : ladders) {
            Rung rung = ladder.match(snapshot).orElse(null);
            if (rung == null) continue;

            score += rung.adjustment();
            for (Finding finding : rung.findings()) {
                addFinding(builder, finding);
            }
        }

        return builder.score(clamp(score)).build();
    }

    /**
     * Weighted mean of the sub-scores, renormalized over the categories present.
     * Zero when nothing was scored.
     */
    int overallScore(Map<ParameterCategory, CategoryScore> breakdown) {
        double weighted = 0;
        double totalWeight = 0;
        for (Map.Entry<ParameterCategory, CategoryScore> entry : breakdown.entrySet()) {
            double weight = entry.getKey().getScoreWeight();
            weighted += entry.getValue().getScore() * weight;
            totalWeight += weight;
        }
        if (totalWeight <= 0) {
            return 0;
        }
        return clamp(Decimals.roundToInt(weighted / totalWeight));
    }

    List<String> improvementOpportunities(Map<ParameterCategory, CategoryScore> breakdown, int overall) {
        List<String> opportunities = new ArrayList<>();
        breakdown.forEach((category, categoryScore) -> {
            if (categoryScore.getScore() < OPPORTUNITY_THRESHOLD) {
                opportunities.add("Focus on " + category.getValue() + " improvements (current: "
                    + categoryScore.getScore() + "/100)");
            }
        });

        if (overall < 60) {
            opportunities.add("Consider comprehensive health evaluation");
        } else if (overall < OPPORTUNITY_THRESHOLD) {
            opportunities.add("Focus on high-impact lifestyle changes");
        } else {
            opportunities.add("Maintain current healthy habits");
        }
        return List.copyOf(opportunities);
    }

    /**
     * Next review date, counted from today on the engine clock.
     *   >= 90: 180 days
     *   >= 75: 90 days
     *   >= 60: 30 days
     *   else:  7 days
     */
    LocalDate nextReviewDate(int overall) {
        LocalDate today = LocalDate.now(clock);
        if (overall >= 90) return today.plusDays(180);
        if (overall >= 75) return today.plusDays(90);
        if (overall >= 60) return today.plusDays(30);
        return today.plusDays(7);
    }

    private static void addFinding(CategoryScore.CategoryScoreBuilder builder, Finding finding) {
        FindingType type = finding.type();
        switch (type) {
            case RISK_FACTOR -> builder.riskFactor(finding.text());
            case ALERT -> builder.alert(finding.text());
            case RECOMMENDATION -> builder.recommendation(finding.text());
            case STRENGTH -> builder.strength(finding.text());
        }
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(FULL_SCORE, score));
    }
}
