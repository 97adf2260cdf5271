package com.fintech.gaps.detection;

import com.fintech.gaps.TestTables;
import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.DataQuality;
import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.GapReport;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.SamplingFrequency;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static com.fintech.gaps.TestTables.HOUR;
import static com.fintech.gaps.TestTables.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GapDetector}.
 *
 * Test Strategy:
 * - Complete and gapped hourly series
 * - Multi-period gaps and the missing period count
 * - Unsorted input, index tables, malformed and degenerate tables
 * - Detection leaves its input untouched and is repeatable
 */
@DisplayName("GapDetector Tests")
class GapDetectorTest {

    private GapDetector detector;

    @BeforeEach
    void setUp() {
        detector = new GapDetector(new FrequencyInferencer());
    }

    @Test
    @DisplayName("Complete hourly series should report no gaps")
    void testNoGaps() {
        GapReport report = detector.detect(TestTables.hourly(100), "timestamp");

        assertThat(report.hasGaps()).isFalse();
        assertThat(report.gapCount()).isZero();
        assertThat(report.gapDetails()).isEmpty();
        assertThat(report.expectedFrequency()).isEqualTo(SamplingFrequency.H1);
        assertThat(report.gapThreshold()).isEqualTo(Duration.ofMinutes(90));
        assertThat(report.dataQuality()).isEqualTo(DataQuality.EXCELLENT);
        assertThat(report.totalRows()).isEqualTo(100);
        assertThat(report.timeRange().start()).isEqualTo(Instant.ofEpochMilli(T0));
        assertThat(report.timeRange().end()).isEqualTo(Instant.ofEpochMilli(T0 + 99 * HOUR));
    }

    @Test
    @DisplayName("Should count each removed hour as one missing period")
    void testSingleRowGaps() {
        GapReport report = detector.detect(TestTables.hourly(100, Set.of(10, 20, 30, 40, 50)), "timestamp");

        assertThat(report.hasGaps()).isTrue();
        assertThat(report.gapCount()).isEqualTo(5);
        assertThat(report.gapDetails()).hasSize(5);
        assertThat(report.gapDetails()).allSatisfy(gap -> {
            assertThat(gap.size()).isEqualTo(1);
            assertThat(gap.duration()).isEqualTo(Duration.ofHours(2));
        });
        assertThat(report.gapDetails().get(0).start()).isEqualTo(Instant.ofEpochMilli(T0 + 9 * HOUR));
        assertThat(report.gapDetails().get(0).end()).isEqualTo(Instant.ofEpochMilli(T0 + 11 * HOUR));
        assertThat(report.totalRows()).isEqualTo(95);
        assertThat(report.dataQuality()).isEqualTo(DataQuality.POOR);
    }

    @Test
    @DisplayName("A gap spanning several periods should add all of them")
    void testMultiPeriodGap() {
        GapReport report = detector.detect(TestTables.hourly(50, Set.of(10, 11, 12)), "timestamp");

        assertThat(report.gapDetails()).hasSize(1);
        assertThat(report.gapCount()).isEqualTo(3);
        assertThat(report.largestGapSize()).isEqualTo(3);
        assertThat(report.averageGapSize()).isEqualTo(3.0);
    }

    @ParameterizedTest(name = "{0} missing of {1} rows -> {2}")
    @MethodSource("qualityProvider")
    @DisplayName("Should grade data quality from the gap ratio")
    void testQualityGrades(Set<Integer> missing, int rows, DataQuality expected) {
        GapReport report = detector.detect(TestTables.hourly(rows, missing), "timestamp");

        assertThat(report.dataQuality()).isEqualTo(expected);
    }

    static Stream<Arguments> qualityProvider() {
        return Stream.of(
            Arguments.of(Set.of(), 200, DataQuality.EXCELLENT),
            Arguments.of(Set.of(100), 201, DataQuality.GOOD),
            Arguments.of(Set.of(50, 100, 150), 203, DataQuality.FAIR),
            Arguments.of(Set.of(10, 20, 30, 40, 50), 55, DataQuality.POOR)
        );
    }

    @Test
    @DisplayName("Gap intervals should not overlap and should be in time order")
    void testGapOrdering() {
        GapReport report = detector.detect(TestTables.hourly(60, Set.of(5, 6, 30, 45)), "timestamp");

        assertThat(report.gapDetails()).hasSize(3);
        for (int i = 1; i < report.gapDetails().size(); i++) {
            assertThat(report.gapDetails().get(i).start())
                .isAfterOrEqualTo(report.gapDetails().get(i - 1).end());
        }
    }

    @Test
    @DisplayName("Unsorted rows should be detected like sorted ones, without reordering the input")
    void testUnsortedInput() {
        TimeSeriesTable sorted = TestTables.hourly(30, Set.of(7, 19));
        int[] reversed = new int[sorted.rowCount()];
        for (int i = 0; i < reversed.length; i++) {
            reversed[i] = reversed.length - 1 - i;
        }
        TimeSeriesTable shuffled = sorted.reorder(reversed);
        Object firstBefore = shuffled.column("timestamp").get(0);

        GapReport report = detector.detect(shuffled, "timestamp");

        assertThat(report.gapCount()).isEqualTo(2);
        assertThat(shuffled.column("timestamp").get(0)).isEqualTo(firstBefore);
    }

    @Test
    @DisplayName("Detecting twice should yield equal reports")
    void testIdempotent() {
        TimeSeriesTable table = TestTables.hourly(48, Set.of(3, 4, 40));

        assertThat(detector.detect(table, "timestamp")).isEqualTo(detector.detect(table, "timestamp"));
    }

    @Test
    @DisplayName("Should detect gaps in a timestamp index")
    void testIndexTable() {
        TimeSeriesTable table = TestTables.hourlyIndexed(24, Set.of(10, 20));

        GapReport report = detector.detect(table, TimestampField.index("index"));

        assertThat(report.gapCount()).isEqualTo(2);
        assertThat(table.hasTimestampIndex()).isTrue();
    }

    @Test
    @DisplayName("Empty table should be excellent with no gaps")
    void testEmptyTable() {
        TimeSeriesTable table = TimeSeriesTable.of(List.of(new Column("timestamp", ColumnType.TIMESTAMP)));

        GapReport report = detector.detect(table, "timestamp");

        assertThat(report.hasGaps()).isFalse();
        assertThat(report.dataQuality()).isEqualTo(DataQuality.EXCELLENT);
        assertThat(report.expectedFrequency()).isEqualTo(SamplingFrequency.DEFAULT);
        assertThat(report.timeRange()).isNull();
    }

    @Test
    @DisplayName("Single row should have no gaps and the default frequency")
    void testSingleRow() {
        GapReport report = detector.detect(TestTables.hourly(1), "timestamp");

        assertThat(report.hasGaps()).isFalse();
        assertThat(report.expectedFrequency()).isEqualTo(SamplingFrequency.H1);
        assertThat(report.dataQuality()).isEqualTo(DataQuality.EXCELLENT);
    }

    @Test
    @DisplayName("Unparseable timestamps should be dropped and noted")
    void testMalformedTimestamps() {
        Column timestamp = new Column("timestamp", ColumnType.STRING);
        timestamp.add("2024-01-01T00:00:00Z");
        timestamp.add("garbage");
        timestamp.add("2024-01-01T01:00:00Z");
        timestamp.add("2024-01-01T02:00:00Z");
        timestamp.add("2024-01-01T04:00:00Z");

        GapReport report = detector.detect(TimeSeriesTable.of(List.of(timestamp)), "timestamp");

        assertThat(report.gapCount()).isEqualTo(1);
        assertThat(report.expectedFrequency()).isEqualTo(SamplingFrequency.H1);
        assertThat(report.notes()).hasSize(1);
        assertThat(report.notes().get(0)).contains("Dropped 1 of 5");
    }

    @Test
    @DisplayName("A table without any parseable timestamp should be poor")
    void testNoParseableTimestamps() {
        Column timestamp = new Column("timestamp", ColumnType.STRING);
        timestamp.add("garbage");
        timestamp.add("rubbish");

        GapReport report = detector.detect(TimeSeriesTable.of(List.of(timestamp)), "timestamp");

        assertThat(report.hasGaps()).isFalse();
        assertThat(report.dataQuality()).isEqualTo(DataQuality.POOR);
        assertThat(report.notes()).anyMatch(note -> note.startsWith("No parseable timestamps"));
    }

    @Test
    @DisplayName("Missing timestamp field should fail with NO_TIMESTAMP_FIELD")
    void testMissingField() {
        assertThatThrownBy(() -> detector.detect(TestTables.hourly(5), "when"))
            .isInstanceOf(GapRepairException.class)
            .hasFieldOrPropertyWithValue("errorType", RepairErrorType.NO_TIMESTAMP_FIELD);
    }

    @Test
    @DisplayName("Tolerance below one should be rejected")
    void testToleranceValidation() {
        assertThatThrownBy(() -> new GapDetector(new FrequencyInferencer(), 0.9))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "{0}ms at {1}ms -> {2}")
    @MethodSource("missingPeriodProvider")
    @DisplayName("Should count missing periods inside an interval")
    void testMissingPeriods(long duration, long frequency, long expected) {
        assertThat(GapDetector.missingPeriods(duration, frequency)).isEqualTo(expected);
    }

    static Stream<Arguments> missingPeriodProvider() {
        return Stream.of(
            Arguments.of(2 * HOUR, HOUR, 1L),
            Arguments.of(4 * HOUR, HOUR, 3L),
            Arguments.of(HOUR + HOUR * 6 / 10, HOUR, 1L),
            Arguments.of(25 * HOUR, HOUR, 24L)
        );
    }
}
