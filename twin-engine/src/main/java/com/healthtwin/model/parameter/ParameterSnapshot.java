package com.healthtwin.model.parameter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.enums.ParameterCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of physiological parameter values.
 *
 * Numeric parameters hold a {@link Double}, categorical ones a label {@link String}.
 * A parameter may be present with a null value (reported as unavailable). Every
 * transformation returns a new snapshot; the original is never modified.
 */
@Slf4j
public final class ParameterSnapshot {

    public static final String DEMOGRAPHICS = "demographics";

    private static final ParameterSnapshot EMPTY = new ParameterSnapshot(new EnumMap<>(Parameter.class), null);

    private final Map<Parameter, Object> values;
    private final DemographicProfile demographics;

    private ParameterSnapshot(EnumMap<Parameter, Object> values, DemographicProfile demographics) {
        this.values = Collections.unmodifiableMap(values);
        this.demographics = demographics;
    }

    public static ParameterSnapshot empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        builder.demographics = demographics;
        return builder;
    }

    /**
     * Builds a snapshot from the nested category -> field -> value form used on the wire,
     * plus an optional {@value #DEMOGRAPHICS} block. Unknown categories and fields are
     * skipped, as is a field filed under a category it does not belong to.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ParameterSnapshot fromNestedMap(Map<String, ? extends Map<String, ?>> nested) {
        Builder builder = builder();
        if (nested == null) {
            return builder.build();
        }
        nested.forEach((categoryName, fields) -> {
            if (DEMOGRAPHICS.equals(categoryName)) {
                builder.demographics(DemographicProfile.fromMap(fields));
                return;
            }
            ParameterCategory category = ParameterCategory.fromValue(categoryName);
            if (category == null) {
                log.debug("Ignoring unknown parameter category '{}'", categoryName);
                return;
            }
            if (fields == null) {
                return;
            }
            fields.forEach((key, value) -> {
                Parameter parameter = Parameter.fromKey(key);
                if (parameter == null || parameter.getCategory() != category) {
                    log.debug("Ignoring parameter '{}.{}' outside the category vocabulary", categoryName, key);
                    return;
                }
                builder.set(parameter, value);
            });
        });
        return builder.build();
    }

    public boolean has(Parameter parameter) {
        return values.containsKey(parameter);
    }

    public Object value(Parameter parameter) {
        return values.get(parameter);
    }

    /**
     * Numeric value, or null when absent, null, or categorical.
     */
    public Double number(Parameter parameter) {
        Object value = values.get(parameter);
        return value instanceof Double number ? number : null;
    }

    public String label(Parameter parameter) {
        Object value = values.get(parameter);
        return value instanceof String label ? label : null;
    }

    public boolean hasCategory(ParameterCategory category) {
        return values.keySet().stream().anyMatch(p -> p.getCategory() == category);
    }

    /**
     * Present parameters of one category, in catalog order.
     */
    public Map<Parameter, Object> category(ParameterCategory category) {
        Map<Parameter, Object> members = new LinkedHashMap<>();
        values.forEach((parameter, value) -> {
            if (parameter.getCategory() == category) {
                members.put(parameter, value);
            }
        });
        return Collections.unmodifiableMap(members);
    }

    public Map<Parameter, Object> asMap() {
        return values;
    }

    public DemographicProfile getDemographics() {
        return demographics;
    }

    public ParameterSnapshot with(Parameter parameter, Object value) {
        return toBuilder().set(parameter, value).build();
    }

    public ParameterSnapshot withDemographics(DemographicProfile profile) {
        return toBuilder().demographics(profile).build();
    }

    /**
     * Nested category -> field -> value view, categories in catalog order.
     */
    public Map<String, Map<String, Object>> toNestedMap() {
        Map<String, Map<String, Object>> nested = new LinkedHashMap<>();
        values.forEach((parameter, value) -> nested
            .computeIfAbsent(parameter.getCategory().getValue(), k -> new LinkedHashMap<>())
            .put(parameter.getKey(), value));
        return nested;
    }

    /**
     * Wire form: the nested view followed by the demographics block when one is attached.
     */
    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>(toNestedMap());
        if (demographics != null) {
            json.put(DEMOGRAPHICS, demographics);
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterSnapshot other)) return false;
        return values.equals(other.values) && Objects.equals(demographics, other.demographics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, demographics);
    }

    @Override
    public String toString() {
        return "ParameterSnapshot" + toNestedMap();
    }

    public static final class Builder {

        private final EnumMap<Parameter, Object> values = new EnumMap<>(Parameter.class);
        private DemographicProfile demographics;

        private Builder() {}

        /**
         * Sets a parameter. Numbers are stored as doubles; labels are only accepted for
         * categorical parameters. A null value records the parameter as unavailable.
         */
        public Builder set(Parameter parameter, Object value) {
            values.put(parameter, normalize(parameter, value));
            return this;
        }

        public Builder remove(Parameter parameter) {
            values.remove(parameter);
            return this;
        }

        public Builder demographics(DemographicProfile demographics) {
            this.demographics = demographics;
            return this;
        }

        public ParameterSnapshot build() {
            return new ParameterSnapshot(values.clone(), demographics);
        }

        private static Object normalize(Parameter parameter, Object value) {
            if (value == null) {
                return null;
            }
            if (parameter.isCategorical()) {
                if (value instanceof String label) {
                    return label;
                }
                throw new InvalidSimulationInputException(
                    "Expected a label for " + parameter.getKey() + " but got " + value);
            }
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            throw new InvalidSimulationInputException(
                "Expected a number for " + parameter.getKey() + " but got '" + value + "'");
        }
    }
}
