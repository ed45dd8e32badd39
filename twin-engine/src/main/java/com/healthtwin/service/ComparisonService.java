package com.healthtwin.service;

import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.util.Decimals;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleFunction;

/**
 * Summarizes improvements between two snapshots. A statement is produced only for fields
 * present in both snapshots that moved in the desired direction.
 */
@Service
public class ComparisonService {

    private static final List<Improvement> IMPROVEMENTS = List.of(
        Improvement.decrease(Parameter.BLOOD_PRESSURE_SYSTOLIC,
            d -> "Blood pressure reduced by " + Decimals.format(d) + " mmHg systolic"),
        Improvement.decrease(Parameter.BLOOD_PRESSURE_DIASTOLIC,
            d -> "Blood pressure reduced by " + Decimals.format(d) + " mmHg diastolic"),
        Improvement.decrease(Parameter.GLUCOSE_FASTING,
            d -> "Fasting glucose reduced by " + Decimals.format(d) + " mg/dL"),
        Improvement.decrease(Parameter.HBA1C,
            d -> String.format(Locale.ROOT, "HbA1c reduced by %.1f%%", d)),
        Improvement.decrease(Parameter.LDL,
            d -> "LDL cholesterol reduced by " + Decimals.format(d) + " mg/dL"),
        Improvement.increase(Parameter.HDL,
            d -> "HDL cholesterol increased by " + Decimals.format(d) + " mg/dL")
    );

    public List<String> compare(ParameterSnapshot before, ParameterSnapshot after) {
        List<String> improvements = new ArrayList<>();
        for (Improvement improvement : IMPROVEMENTS) {
            Double from = before.number(improvement.parameter());
            Double to = after.number(improvement.parameter());
            if (from == null || to == null) continue;

            double gain = improvement.increasing() ? to - from : from - to;
            if (gain > 0) {
                improvements.add(improvement.message().apply(gain));
            }
        }
        return improvements;
    }

    private record Improvement(Parameter parameter, boolean increasing, DoubleFunction<String> message) {

        static Improvement decrease(Parameter parameter, DoubleFunction<String> message) {
            return new Improvement(parameter, false, message);
        }

        static Improvement increase(Parameter parameter, DoubleFunction<String> message) {
            return new Improvement(parameter, true, message);
        }
    }
}
