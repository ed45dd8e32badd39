package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterChange;
import com.healthtwin.model.parameter.ParameterSnapshot;
import com.healthtwin.model.progression.RowValue;
import com.healthtwin.model.progression.WeekResult;
import com.healthtwin.model.progression.WeeklyRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly Progression Service
 *
 * Folds weekly rows into a running snapshot, one step per week from 1 to the duration.
 * A week without a row carries the previous snapshot forward; when several rows share a
 * week index only the first one is used.
 */
@Slf4j
@Service
public class WeeklyProgressionService {

    public List<WeekResult> progress(ParameterSnapshot baseline, List<WeeklyRow> rows, int durationWeeks) {
        if (baseline == null) {
            throw new InvalidSimulationInputException("Baseline parameters are required");
        }
        if (rows == null || rows.isEmpty()) {
            throw new InvalidSimulationInputException("Weekly data must contain at least one row");
        }
        if (durationWeeks < 1) {
            throw new InvalidSimulationInputException("Duration must be at least one week: " + durationWeeks);
        }

        Map<Integer, WeeklyRow> byWeek = new HashMap<>();
        for (WeeklyRow row : rows) {
            if (byWeek.putIfAbsent(row.week(), row) != null) {
                log.debug("Ignoring duplicate row for week {}", row.week());
            }
        }

        List<WeekResult> results = new ArrayList<>(durationWeeks);
        ParameterSnapshot current = baseline;
        for (int week = 1; week <= durationWeeks; week++) {
            WeeklyRow row = byWeek.get(week);
            if (row != null) {
                current = apply(current, row);
            }
            results.add(new WeekResult(week, current, changesFromBaseline(baseline, current)));
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Applies one row to a snapshot. Values that do not fit the parameter's kind are ignored.
     */
    public ParameterSnapshot apply(ParameterSnapshot snapshot, WeeklyRow row) {
        ParameterSnapshot.Builder builder = snapshot.toBuilder();
        row.values().forEach((parameter, value) -> {
            if (value instanceof RowValue.Absolute absolute && parameter.isNumeric()) {
                builder.set(parameter, absolute.value());
            } else if (value instanceof RowValue.Relative relative && parameter.isNumeric()) {
                Double existing = snapshot.number(parameter);
                builder.set(parameter, (existing != null ? existing : 0) + relative.delta());
            } else if (value instanceof RowValue.Label label && parameter.isCategorical()) {
                builder.set(parameter, label.text());
            } else {
                log.debug("Ignoring {} value for {} in week {}", value, parameter.getKey(), row.week());
            }
        });
        return DerivedMetrics.refreshBmi(snapshot, builder.build());
    }

    /**
     * Change of every numeric parameter present in both snapshots.
     */
    public Map<Parameter, ParameterChange> changesFromBaseline(ParameterSnapshot baseline, ParameterSnapshot current) {
        Map<Parameter, ParameterChange> changes = new EnumMap<>(Parameter.class);
        for (Parameter parameter : current.asMap().keySet()) {
            Double before = baseline.number(parameter);
            Double after = current.number(parameter);
            if (before != null && after != null) {
                changes.put(parameter, ParameterChange.between(before, after));
            }
        }
        return Collections.unmodifiableMap(changes);
    }
}
