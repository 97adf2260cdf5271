package com.fintech.gaps.detection;

import com.fintech.gaps.TestTables;
import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimestampColumnLocator Tests")
class TimestampColumnLocatorTest {

    private TimestampColumnLocator locator;

    @BeforeEach
    void setUp() {
        locator = new TimestampColumnLocator();
    }

    @Test
    @DisplayName("Should prefer a timestamp index")
    void testIndexFirst() {
        TimestampField field = locator.locate(TestTables.hourlyIndexed(5, Set.of()));

        assertThat(field).isEqualTo(TimestampField.index("index"));
    }

    @Test
    @DisplayName("Should try conventional names in order")
    void testConventionalNames() {
        TimeSeriesTable table = TimeSeriesTable.of(List.of(
            strings("time", "a"), strings("timestamp", "b"), strings("value", "c")));

        assertThat(locator.locate(table)).isEqualTo(TimestampField.column("timestamp"));
    }

    @Test
    @DisplayName("Should fall back to the first TIMESTAMP-typed column")
    void testTypedColumn() {
        Column recordedAt = new Column("recorded_at", ColumnType.TIMESTAMP);
        recordedAt.add(TestTables.T0);
        Column value = new Column("value", ColumnType.DOUBLE);
        value.add(1.0);

        TimestampField field = locator.locate(TimeSeriesTable.of(List.of(value, recordedAt)));

        assertThat(field).isEqualTo(TimestampField.column("recorded_at"));
    }

    @Test
    @DisplayName("Should find a string column whose values parse as timestamps")
    void testContentScan() {
        TimeSeriesTable table = TimeSeriesTable.of(List.of(
            strings("label", "alpha", "beta"),
            strings("observed", "2024-01-01T00:00:00Z", "2024-01-01T01:00:00Z")));

        assertThat(locator.locate(table)).isEqualTo(TimestampField.column("observed"));
    }

    @Test
    @DisplayName("Should only sample the leading values of a string column")
    void testSampleSize() {
        String[] values = new String[TimestampColumnLocator.SAMPLE_SIZE + 1];
        for (int i = 0; i < TimestampColumnLocator.SAMPLE_SIZE; i++) {
            values[i] = "2024-01-01 0" + (i % 10) + ":00:00";
        }
        values[TimestampColumnLocator.SAMPLE_SIZE] = "not a date";

        TimeSeriesTable table = TimeSeriesTable.of(List.of(strings("observed", values)));

        assertThat(locator.locate(table)).isEqualTo(TimestampField.column("observed"));
    }

    @Test
    @DisplayName("Should report none when no field qualifies")
    void testNone() {
        Column value = new Column("value", ColumnType.DOUBLE);
        value.add(1.0);

        TimestampField field = locator.locate(TimeSeriesTable.of(List.of(value, strings("label", "x"))));

        assertThat(field.isFound()).isFalse();
    }

    private static Column strings(String name, String... values) {
        Column column = new Column(name, ColumnType.STRING);
        for (String value : values) {
            column.add(value);
        }
        return column;
    }
}
