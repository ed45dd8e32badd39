package com.healthtwin.service;

import com.healthtwin.model.enums.Flag;
import com.healthtwin.model.enums.ParameterCategory;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.parameter.ReferenceRange;
import com.healthtwin.model.report.AnnotatedValue;
import com.healthtwin.model.report.ScoredReport;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the virtual lab report for a snapshot: every present value annotated with unit,
 * reference range and flag, the derived BMI and eGFR, and the scored interpretation.
 */
@Service
public class ReportBuilderService {

    private final HealthScoringService healthScoringService;
    private final Clock clock;

    public ReportBuilderService(HealthScoringService healthScoringService, Clock clock) {
        this.healthScoringService = healthScoringService;
        this.clock = clock;
    }

    public ScoredReport build(ParameterSnapshot snapshot) {
        Map<ParameterCategory, Map<Parameter, AnnotatedValue>> sections = new EnumMap<>(ParameterCategory.class);
        snapshot.asMap().forEach((parameter, value) -> sections
            .computeIfAbsent(parameter.getCategory(), c -> new LinkedHashMap<>())
            .put(parameter, annotate(parameter, value)));
        sections.replaceAll((category, values) -> Collections.unmodifiableMap(values));

        return ScoredReport.builder()
            .reportDate(LocalDateTime.now(clock))
            .bmi(DerivedMetrics.bmi(snapshot))
            .egfr(DerivedMetrics.egfr(snapshot))
            .sections(Collections.unmodifiableMap(sections))
            .interpretation(healthScoringService.score(snapshot))
            .build();
    }

    /**
     * Flag rules: N/A for a null value, L/H outside the range, N otherwise
     * (including labels and parameters without a range).
     */
    public static AnnotatedValue annotate(Parameter parameter, Object value) {
        ReferenceRange range = parameter.getRange();
        String rangeText = range != null ? range.display() : "";
        return new AnnotatedValue(value, parameter.getUnit(), rangeText, flag(parameter, value));
    }

    static Flag flag(Parameter parameter, Object value) {
        if (value == null) {
            return Flag.UNAVAILABLE;
        }
        ReferenceRange range = parameter.getRange();
        if (range == null || !(value instanceof Double number)) {
            return Flag.NORMAL;
        }
        return range.flag(number);
    }
}
