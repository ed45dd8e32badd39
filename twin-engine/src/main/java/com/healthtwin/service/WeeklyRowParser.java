package com.healthtwin.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.progression.RowValue;
import com.healthtwin.model.progression.WeeklyRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly Row Parser
 *
 * Turns tabular records into typed weekly rows. Records are keyed by parameter name
 * plus "week" (or "week_number"). Cell rules:
 * - null or blank: skipped
 * - booleans and "true"/"false": flag
 * - numbers and numeric text: absolute value
 * - text with a leading '+' or '-': relative delta, dropped when the rest is not a number
 * - any other text: label
 */
@Slf4j
@Service
public class WeeklyRowParser {

    static final String WEEK = "week";
    static final String WEEK_NUMBER = "week_number";

    private final CsvMapper csvMapper = new CsvMapper();

    public List<WeeklyRow> parse(List<? extends Map<String, ?>> records) {
        if (records == null || records.isEmpty()) {
            throw new InvalidSimulationInputException("Weekly data must contain at least one row");
        }
        List<WeeklyRow> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            rows.add(parseRecord(record));
        }
        return rows;
    }

    /**
     * Parses CSV text whose first line names the columns.
     */
    public List<WeeklyRow> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new InvalidSimulationInputException("Weekly data must contain at least one row");
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(csv)) {
            return parse(iterator.readAll());
        } catch (IOException e) {
            throw new InvalidSimulationInputException("Unreadable weekly CSV data: " + e.getMessage(), e);
        }
    }

    WeeklyRow parseRecord(Map<String, ?> record) {
        if (record == null) {
            throw new InvalidSimulationInputException("Weekly row must not be null");
        }
        int week = weekIndex(record);
        Map<Parameter, RowValue> values = new EnumMap<>(Parameter.class);

        record.forEach((column, cell) -> {
            if (WEEK.equals(column) || WEEK_NUMBER.equals(column)) {
                return;
            }
            Parameter parameter = Parameter.fromKey(column);
            if (parameter == null) {
                log.debug("Ignoring unknown column '{}' in week {}", column, week);
                return;
            }
            RowValue value = parseCell(cell);
            if (value != null) {
                values.put(parameter, value);
            }
        });

        return WeeklyRow.of(week, values);
    }

    /**
     * Typed value of one cell, or null when the cell carries nothing usable.
     */
    RowValue parseCell(Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Boolean flag) {
            return new RowValue.Toggle(flag);
        }
        if (cell instanceof Number number) {
            return RowValue.absolute(number.doubleValue());
        }

        String text = cell.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return new RowValue.Toggle(Boolean.parseBoolean(text));
        }
        if (text.startsWith("+") || text.startsWith("-")) {
            Double delta = parseNumber(text);
            if (delta == null) {
                log.debug("Dropping unparsable delta '{}'", text);
                return null;
            }
            return RowValue.relative(delta);
        }
        Double number = parseNumber(text);
        return number != null ? RowValue.absolute(number) : RowValue.label(text);
    }

    private int weekIndex(Map<String, ?> record) {
        Object raw = record.get(WEEK);
        if (raw == null) {
            raw = record.get(WEEK_NUMBER);
        }
        if (raw == null || raw.toString().isBlank()) {
            throw new InvalidSimulationInputException("Weekly row has no week index: " + record.keySet());
        }

        Double week = raw instanceof Number number ? Double.valueOf(number.doubleValue()) : parseNumber(raw.toString().trim());
        if (week == null || week != Math.rint(week)) {
            throw new InvalidSimulationInputException("Invalid week index '" + raw + "'");
        }
        return week.intValue();
    }

    private static Double parseNumber(String text) {
        try {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
