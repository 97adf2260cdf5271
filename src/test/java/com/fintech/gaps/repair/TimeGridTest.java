package com.fintech.gaps.repair;

import com.fintech.gaps.TestTables;
import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.SamplingFrequency;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Set;
import java.util.stream.Stream;

import static com.fintech.gaps.TestTables.HOUR;
import static com.fintech.gaps.TestTables.T0;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TimeGrid}.
 *
 * Test Strategy:
 * - Slot counting for on-grid and off-grid intervals
 * - Reindexing keeps every original row and fills slots with nulls
 * - Slot timestamps rendered in the key column's own representation
 */
@DisplayName("TimeGrid Tests")
class TimeGridTest {

    private TimeGrid grid;

    @BeforeEach
    void setUp() {
        grid = new TimeGrid(SamplingFrequency.H1, 90 * 60_000L);
    }

    @ParameterizedTest(name = "interval {0}ms -> {1} slots")
    @MethodSource("intervalProvider")
    @DisplayName("Should insert slots only inside gaps")
    void testPointsToInsert(long interval, int expected) {
        assertThat(grid.pointsToInsert(T0, T0 + interval)).isEqualTo(expected);
    }

    static Stream<Arguments> intervalProvider() {
        return Stream.of(
            Arguments.of(HOUR, 0),
            Arguments.of(HOUR * 3 / 2, 0),
            Arguments.of(HOUR * 8 / 5, 1),
            Arguments.of(2 * HOUR, 1),
            Arguments.of(HOUR * 13 / 5, 2),
            Arguments.of(4 * HOUR, 3),
            Arguments.of(25 * HOUR, 24)
        );
    }

    @Test
    @DisplayName("Missing slots should sit on the grid after the previous sample")
    void testMissingPeriodsBetween() {
        assertThat(grid.missingPeriodsBetween(T0, T0 + 4 * HOUR))
            .containsExactly(T0 + HOUR, T0 + 2 * HOUR, T0 + 3 * HOUR);
        assertThat(grid.missingPeriodsBetween(T0, T0 + HOUR)).isEmpty();
    }

    @Test
    @DisplayName("Reindexing should keep original rows and add empty rows for missing slots")
    void testReindex() {
        TimeSeriesTable table = TestTables.hourly(6, Set.of(2, 3));
        long[] timestamps = {T0, T0 + HOUR, T0 + 4 * HOUR, T0 + 5 * HOUR};

        TimeGrid.Reindexed reindexed = grid.reindex(table, 0, timestamps);

        TimeSeriesTable out = reindexed.table();
        assertThat(out.rowCount()).isEqualTo(6);
        assertThat(reindexed.insertedRows()).isEqualTo(2);
        assertThat(reindexed.originalPositions()).containsExactly(0, 1, 4, 5);
        assertThat(reindexed.timestamps()).containsExactly(
            T0, T0 + HOUR, T0 + 2 * HOUR, T0 + 3 * HOUR, T0 + 4 * HOUR, T0 + 5 * HOUR);
        assertThat(out.column("timestamp").get(2)).isEqualTo(T0 + 2 * HOUR);
        assertThat(out.column("price").get(2)).isNull();
        assertThat(out.column("symbol").get(3)).isNull();
        assertThat(out.column("price").get(4)).isEqualTo(104.0);
        assertThat(table.rowCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Off-grid samples should be kept as observed")
    void testOffGridSamples() {
        long offGrid = T0 + HOUR * 13 / 5;
        TimeSeriesTable table = TestTables.at(new long[] {T0, offGrid}, 1.0, 2.0);

        TimeGrid.Reindexed reindexed = grid.reindex(table, 0, new long[] {T0, offGrid});

        assertThat(reindexed.timestamps()).containsExactly(T0, T0 + HOUR, T0 + 2 * HOUR, offGrid);
        for (int i = 1; i < reindexed.timestamps().length; i++) {
            assertThat(reindexed.timestamps()[i] - reindexed.timestamps()[i - 1]).isLessThanOrEqualTo(HOUR * 3 / 2);
        }
    }

    @Test
    @DisplayName("Slot timestamps should follow the key column's type and format")
    void testTimestampCell() {
        Column text = new Column("ts", ColumnType.STRING, TimestampFormat.SPACE_LOCAL_DATE_TIME);
        Column epoch = new Column("ts", ColumnType.LONG);
        Column fractional = new Column("ts", ColumnType.DOUBLE);
        Column detected = new Column("ts", ColumnType.STRING);
        detected.add("2024-01-01T00:00:00");

        assertThat(TimeGrid.timestampCell(text, T0 + HOUR)).isEqualTo("2024-01-01 01:00:00");
        assertThat(TimeGrid.timestampCell(epoch, T0)).isEqualTo(T0);
        assertThat(TimeGrid.timestampCell(fractional, T0)).isEqualTo((double) T0);
        assertThat(TimeGrid.timestampCell(detected, T0 + HOUR)).isEqualTo("2024-01-01T01:00:00");
    }
}
