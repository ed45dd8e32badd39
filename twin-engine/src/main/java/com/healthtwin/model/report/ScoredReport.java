package com.healthtwin.model.report;

import com.healthtwin.model.enums.ParameterCategory;
import com.healthtwin.model.parameter.Parameter;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Virtual lab report: annotated values per category plus the interpretation.
 * BMI and eGFR are null when the inputs they derive from are missing.
 */
@Value
@Builder
public class ScoredReport {

    LocalDateTime reportDate;

    Double bmi;

    Double egfr;

    Map<ParameterCategory, Map<Parameter, AnnotatedValue>> sections;

    Interpretation interpretation;

    public Map<Parameter, AnnotatedValue> section(ParameterCategory category) {
        return sections.getOrDefault(category, Map.of());
    }
}
