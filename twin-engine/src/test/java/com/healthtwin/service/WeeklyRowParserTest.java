package com.healthtwin.service;

import com.healthtwin.exception.InvalidSimulationInputException;
import com.healthtwin.model.parameter.Parameter;
import com.healthtwin.model.progression.RowValue;
import com.healthtwin.model.progression.WeeklyRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WeeklyRowParserTest {

    private WeeklyRowParser parser;

    @BeforeEach
    void setUp() {
        parser = new WeeklyRowParser();
    }

    @Test
    void parsesCellKinds() {
        assertThat(parser.parseCell("+2")).isEqualTo(new RowValue.Relative(2));
        assertThat(parser.parseCell("-0.5")).isEqualTo(new RowValue.Relative(-0.5));
        assertThat(parser.parseCell("72.5")).isEqualTo(new RowValue.Absolute(72.5));
        assertThat(parser.parseCell(140)).isEqualTo(new RowValue.Absolute(140));
        assertThat(parser.parseCell("current")).isEqualTo(new RowValue.Label("current"));
        assertThat(parser.parseCell("TRUE")).isEqualTo(new RowValue.Toggle(true));
        assertThat(parser.parseCell(false)).isEqualTo(new RowValue.Toggle(false));
    }

    @Test
    void blankAndUnparsableDeltaCells_areDropped() {
        assertThat(parser.parseCell(null)).isNull();
        assertThat(parser.parseCell("   ")).isNull();
        assertThat(parser.parseCell("+abc")).isNull();
    }

    @Test
    void parsesCsvWithHeader() {
        String csv = """
            week,weight_kg,blood_pressure_systolic,smoking_status,notes
            1,70,,never,started
            3,+2,135,former,
            """;

        List<WeeklyRow> rows = parser.parseCsv(csv);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).week()).isEqualTo(1);
        assertThat(rows.get(0).values())
            .containsEntry(Parameter.WEIGHT_KG, new RowValue.Absolute(70))
            .containsEntry(Parameter.SMOKING_STATUS, new RowValue.Label("never"))
            .doesNotContainKey(Parameter.BLOOD_PRESSURE_SYSTOLIC);
        assertThat(rows.get(1).values())
            .containsEntry(Parameter.WEIGHT_KG, new RowValue.Relative(2))
            .containsEntry(Parameter.BLOOD_PRESSURE_SYSTOLIC, new RowValue.Absolute(135))
            .hasSize(3);
    }

    @Test
    void acceptsWeekNumberColumn_andDropsUnknownColumns() {
        Map<String, Object> record = new HashMap<>();
        record.put("week_number", "2");
        record.put("heart_rate", 68);
        record.put("mood", "great");

        WeeklyRow row = parser.parse(List.of(record)).get(0);

        assertThat(row.week()).isEqualTo(2);
        assertThat(row.values()).containsOnlyKeys(Parameter.HEART_RATE);
    }

    @Test
    void rowWithoutWeekIndex_isRejected() {
        assertThatThrownBy(() -> parser.parse(List.of(Map.of("heart_rate", 70))))
            .isInstanceOf(InvalidSimulationInputException.class)
            .hasMessageContaining("week");
    }

    @Test
    void fractionalOrZeroWeekIndex_isRejected() {
        assertThatThrownBy(() -> parser.parse(List.of(Map.of("week", "1.5"))))
            .isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> parser.parse(List.of(Map.of("week", 0))))
            .isInstanceOf(InvalidSimulationInputException.class);
    }

    @Test
    void emptyInput_isRejected() {
        assertThatThrownBy(() -> parser.parse(List.of())).isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> parser.parseCsv("")).isInstanceOf(InvalidSimulationInputException.class);
        assertThatThrownBy(() -> parser.parseCsv("week,heart_rate\n")).isInstanceOf(InvalidSimulationInputException.class);
    }
}
