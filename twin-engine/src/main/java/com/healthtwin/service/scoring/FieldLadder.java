package com.healthtwin.service.scoring;

import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.parameter.ParameterSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered rungs for one parameter. The first rung matching the value wins; an absent
 * value or one no rung matches contributes nothing.
 */
public record FieldLadder(Parameter parameter, Function<ParameterSnapshot, Object> reader, List<Rung> rungs) {

    public FieldLadder {
        rungs = List.copyOf(rungs);
    }

    public static FieldLadder of(Parameter parameter, Rung... rungs) {
        return new FieldLadder(parameter, snapshot -> snapshot.value(parameter), List.of(rungs));
    }

    public static FieldLadder derived(Parameter parameter, Function<ParameterSnapshot, Object> reader, Rung... rungs) {
        return new FieldLadder(parameter, reader, List.of(rungs));
    }

    public Optional<Rung> match(ParameterSnapshot snapshot) {
        Object value = reader.apply(snapshot);
        if (value == null) {
            return Optional.empty();
        }
        return rungs.stream().filter(rung -> rung.test(value)).findFirst();
    }
}
