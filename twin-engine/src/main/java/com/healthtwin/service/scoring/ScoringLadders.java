package com.healthtwin.service.scoring;

import com.healthtwin.model.enums.ParameterCategory;
import com.healthtwin.service.DerivedMetrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.healthtwin.model.parameter.Parameter.*;
import static com.healthtwin.model.report.Finding.*;
import static com.healthtwin.service.scoring.Rung.*;

/**
 * Threshold tables of the health score, per category, in scoring order.
 *
 * Gaps between rungs (systolic 121-129, diastolic 81-89, LDL 100-129) are
 * dead zones: the value neither costs points nor counts as a strength.
 */
public final class ScoringLadders {

    private static final String ATTENTION = "Seek immediate medical attention";
    private static final String CONSULT_PROVIDER = "Consult healthcare provider";
    private static final String CONSULT_NOW = "Immediate medical consultation required";

    static final List<FieldLadder> VITALS = List.of(
        FieldLadder.of(BLOOD_PRESSURE_SYSTOLIC,
            atMost(120, 0, strength("Optimal systolic blood pressure")),
            atMost(129, 0),
            atMost(139, -10, risk("Elevated systolic blood pressure"),
                recommendation("Monitor blood pressure regularly")),
            atMost(159, -20, risk("High systolic blood pressure (Stage 1)"),
                alert("Consider lifestyle modifications")),
            atMost(179, -35, risk("High systolic blood pressure (Stage 2)"), alert(CONSULT_PROVIDER)),
            otherwise(-50, risk("Hypertensive crisis"), alert(ATTENTION))),
        FieldLadder.of(BLOOD_PRESSURE_DIASTOLIC,
            atMost(80, 0, strength("Optimal diastolic blood pressure")),
            atMost(89, 0),
            atMost(99, -15, risk("High diastolic blood pressure (Stage 1)"),
                recommendation("Reduce sodium intake and increase exercise")),
            atMost(109, -25, risk("High diastolic blood pressure (Stage 2)"), alert(CONSULT_PROVIDER)),
            otherwise(-40, risk("Diastolic hypertensive crisis"), alert(ATTENTION))),
        FieldLadder.of(HEART_RATE,
            between(60, 100, 0, strength("Normal heart rate")),
            below(60, -15, risk("Bradycardia (slow heart rate)"),
                recommendation("Monitor heart rate and consult if persistent")),
            otherwise(-15, risk("Tachycardia (fast heart rate)"),
                recommendation("Monitor heart rate and consult if persistent"))),
        FieldLadder.derived(BMI, DerivedMetrics::bmi,
            between(18.5, 24.9, 0, strength("Healthy BMI")),
            below(18.5, -10, risk("Underweight"),
                recommendation("Consult nutritionist for healthy weight gain")),
            atMost(29.9, -15, risk("Overweight"),
                recommendation("Focus on balanced diet and regular exercise")),
            atMost(34.9, -25, risk("Obesity (Class 1)"), alert("Consider weight management program")),
            atMost(39.9, -35, risk("Obesity (Class 2)"),
                alert("Consult healthcare provider for weight management")),
            otherwise(-45, risk("Severe obesity (Class 3)"), alert("Seek specialized medical care")))
    );

    static final List<FieldLadder> METABOLIC = List.of(
        FieldLadder.of(GLUCOSE_FASTING,
            atMost(99, 0, strength("Normal fasting glucose")),
            atMost(125, -25, risk("Prediabetes (elevated fasting glucose)"),
                recommendation("Implement lifestyle modifications"),
                alert("Monitor glucose levels regularly")),
            otherwise(-45, risk("Diabetes (elevated fasting glucose)"),
                alert("Consult healthcare provider immediately"))),
        FieldLadder.of(HBA1C,
            atMost(5.6, 0, strength("Normal HbA1c")),
            atMost(6.4, -30, risk("Prediabetes (elevated HbA1c)"),
                recommendation("Focus on diet and exercise"),
                alert("Regular diabetes screening")),
            otherwise(-50, risk("Diabetes (elevated HbA1c)"), alert(CONSULT_NOW))),
        FieldLadder.of(CREATININE,
            atMost(1.2, 0, strength("Normal kidney function")),
            otherwise(-20, risk("Elevated creatinine"),
                recommendation("Monitor kidney function"),
                alert("Consult nephrologist if persistent")))
    );

    static final List<FieldLadder> LIPIDS = List.of(
        FieldLadder.of(LDL,
            atMost(99, 0, strength("Optimal LDL cholesterol")),
            atMost(129, 0),
            atMost(159, -20, risk("Borderline high LDL cholesterol"),
                recommendation("Implement heart-healthy diet")),
            atMost(189, -30, risk("High LDL cholesterol"),
                recommendation("Consider medication consultation"),
                alert("Monitor cardiovascular risk")),
            otherwise(-45, risk("Very high LDL cholesterol"), alert(CONSULT_NOW))),
        FieldLadder.of(HDL,
            atLeast(60, 10, strength("High HDL cholesterol (protective)")),
            atLeast(40, 0, strength("Normal HDL cholesterol")),
            otherwise(-20, risk("Low HDL cholesterol"),
                recommendation("Increase physical activity and healthy fats"))),
        FieldLadder.of(TRIGLYCERIDES,
            atMost(149, 0, strength("Normal triglyceride levels")),
            atMost(199, -15, risk("Borderline high triglycerides"),
                recommendation("Reduce refined carbohydrates and alcohol")),
            atMost(499, -25, risk("High triglycerides"),
                recommendation("Implement comprehensive lifestyle changes"),
                alert("Monitor for metabolic syndrome")),
            otherwise(-40, risk("Very high triglycerides"), alert(CONSULT_NOW)))
    );

    // Anything outside 6-9 hours, including oversleeping, counts as insufficient sleep.
    static final List<FieldLadder> LIFESTYLE = List.of(
        FieldLadder.of(EXERCISE_FREQUENCY,
            atLeast(5, 10, strength("Excellent exercise routine")),
            atLeast(3, 0, strength("Good exercise routine")),
            atLeast(1, -15, risk("Insufficient physical activity"),
                recommendation("Increase exercise to 3+ times per week")),
            otherwise(-25, risk("Sedentary lifestyle"),
                recommendation("Start with walking 30 minutes daily"),
                alert("High risk for chronic diseases"))),
        FieldLadder.of(SLEEP_DURATION,
            between(7, 9, 0, strength("Optimal sleep duration")),
            halfOpen(6, 7, -10, risk("Slightly insufficient sleep"),
                recommendation("Aim for 7-9 hours of sleep")),
            otherwise(-25, risk("Insufficient sleep"),
                recommendation("Prioritize sleep hygiene and schedule"),
                alert("Sleep deprivation affects all health markers"))),
        FieldLadder.of(STRESS_LEVEL,
            atMost(3, 0, strength("Low stress levels")),
            atMost(6, -10, risk("Moderate stress levels"),
                recommendation("Implement stress management techniques")),
            otherwise(-20, risk("High stress levels"),
                recommendation("Consider counseling or stress management programs"),
                alert("Chronic stress impacts overall health"))),
        FieldLadder.of(SMOKING_STATUS,
            is("current", -30, risk("Current smoker"),
                recommendation("Consider smoking cessation program"),
                alert("Smoking significantly increases health risks")),
            is("former", -5, risk("Former smoker"), recommendation("Maintain smoke-free lifestyle"))),
        FieldLadder.of(ALCOHOL_CONSUMPTION,
            is("heavy", -25, risk("Heavy alcohol consumption"),
                recommendation("Reduce alcohol intake"),
                alert("Consult healthcare provider about alcohol use")),
            is("moderate", -5, risk("Moderate alcohol consumption"), recommendation("Monitor alcohol intake")))
    );

    static final List<FieldLadder> CBC = List.of(
        FieldLadder.of(HEMOGLOBIN,
            below(12, -15, risk("Low hemoglobin (possible anemia)"),
                recommendation("Consult healthcare provider for evaluation")))
    );

    static final List<FieldLadder> LIVER = List.of(
        FieldLadder.of(ALT,
            above(55, -15, risk("Elevated ALT"), recommendation("Monitor liver function")))
    );

    static final List<FieldLadder> THYROID = List.of(
        FieldLadder.of(TSH,
            above(4.0, -15, risk("Elevated TSH"), recommendation("Monitor thyroid function")))
    );

    private static final Map<ParameterCategory, List<FieldLadder>> BY_CATEGORY;

    static {
        Map<ParameterCategory, List<FieldLadder>> ordered = new LinkedHashMap<>();
        ordered.put(ParameterCategory.VITALS, VITALS);
        ordered.put(ParameterCategory.METABOLIC, METABOLIC);
        ordered.put(ParameterCategory.LIPIDS, LIPIDS);
        ordered.put(ParameterCategory.LIFESTYLE, LIFESTYLE);
        ordered.put(ParameterCategory.CBC, CBC);
        ordered.put(ParameterCategory.LIVER, LIVER);
        ordered.put(ParameterCategory.THYROID, THYROID);
        BY_CATEGORY = Collections.unmodifiableMap(ordered);
    }

    private ScoringLadders() {}

    /**
     * Scored categories mapped to their ladders, in the order the overall score visits them.
     */
    public static Map<ParameterCategory, List<FieldLadder>> inScoringOrder() {
        return BY_CATEGORY;
    }
}
