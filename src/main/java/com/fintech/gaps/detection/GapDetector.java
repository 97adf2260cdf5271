package com.fintech.gaps.detection;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.DataQuality;
import com.fintech.gaps.domain.Gap;
import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.GapReport;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.SamplingFrequency;
import com.fintech.gaps.domain.TimeRange;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scans a table's timestamps for intervals wider than the gap threshold.
 *
 * <p>Detection algorithm:
 * <ul>
 *   <li>Timestamps are parsed into a sorted copy; the caller's table is never touched</li>
 *   <li>Unparseable timestamps are dropped from detection and reported in the notes</li>
 *   <li>Expected frequency comes from {@link FrequencyInferencer}</li>
 *   <li>Any spacing strictly above {@code frequency * toleranceMultiplier} is a gap</li>
 *   <li>A gap of k missing periods adds k to {@code gapCount}</li>
 * </ul>
 *
 * <p>Detection never throws for malformed data. It only throws when the named
 * timestamp field does not exist.
 */
public class GapDetector {

    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);

    public static final double DEFAULT_TOLERANCE_MULTIPLIER = 1.5;

    private final FrequencyInferencer frequencyInferencer;
    private final double toleranceMultiplier;

    public GapDetector(FrequencyInferencer frequencyInferencer) {
        this(frequencyInferencer, DEFAULT_TOLERANCE_MULTIPLIER);
    }

    public GapDetector(FrequencyInferencer frequencyInferencer, double toleranceMultiplier) {
        if (toleranceMultiplier < 1.0) {
            throw new IllegalArgumentException("Tolerance multiplier must be >= 1.0, got " + toleranceMultiplier);
        }
        this.frequencyInferencer = frequencyInferencer;
        this.toleranceMultiplier = toleranceMultiplier;
    }

    /** Detects gaps in a named timestamp column. */
    public GapReport detect(TimeSeriesTable table, String timestampColumn) {
        return detect(table, TimestampField.column(timestampColumn));
    }

    /**
     * Detects gaps in the given timestamp field.
     *
     * @throws GapRepairException with {@link RepairErrorType#NO_TIMESTAMP_FIELD} if the field does not exist
     */
    public GapReport detect(TimeSeriesTable table, TimestampField field) {
        Column timestamps = timestampColumn(table, field);
        long totalRows = table.rowCount();

        Long[] parsed = TimestampValues.parse(timestamps);
        long[] sorted = Arrays.stream(parsed)
            .filter(v -> v != null)
            .mapToLong(Long::longValue)
            .sorted()
            .toArray();

        List<String> notes = new ArrayList<>();
        int dropped = parsed.length - sorted.length;
        if (dropped > 0) {
            notes.add("Dropped " + dropped + " of " + parsed.length
                + " rows with unparseable timestamps in field '" + timestamps.name() + "'");
            log.warn("Dropped {} rows with unparseable timestamps: field={}", dropped, timestamps.name());
        }

        if (sorted.length == 0) {
            DataQuality quality = totalRows == 0 ? DataQuality.EXCELLENT : DataQuality.POOR;
            if (totalRows > 0) {
                notes.add("No parseable timestamps in field '" + timestamps.name() + "'");
            }
            return emptyReport(quality, null, totalRows, notes);
        }

        SamplingFrequency frequency = frequencyInferencer.infer(sorted);
        long frequencyMs = frequency.toMillis();
        double thresholdMs = frequencyMs * toleranceMultiplier;

        List<Gap> gaps = new ArrayList<>();
        long gapCount = 0;
        for (int i = 1; i < sorted.length; i++) {
            long duration = sorted[i] - sorted[i - 1];
            if (duration > thresholdMs) {
                long size = missingPeriods(duration, frequencyMs);
                gaps.add(new Gap(
                    Instant.ofEpochMilli(sorted[i - 1]),
                    Instant.ofEpochMilli(sorted[i]),
                    size,
                    Duration.ofMillis(duration)));
                gapCount += size;
                log.debug("Gap detected: start={}, end={}, missing={}",
                         Instant.ofEpochMilli(sorted[i - 1]), Instant.ofEpochMilli(sorted[i]), size);
            }
        }

        GapReport report = new GapReport(
            gapCount > 0,
            gapCount,
            gaps,
            frequency,
            Duration.ofMillis(Math.round(thresholdMs)),
            DataQuality.fromGapRatio(gapCount, totalRows),
            TimeRange.ofEpochMillis(sorted[0], sorted[sorted.length - 1]),
            totalRows,
            notes
        );

        log.debug("Detection complete: field={}, rows={}, frequency={}, gaps={}, missing={}, quality={}",
                 timestamps.name(), totalRows, frequency, gaps.size(), gapCount, report.dataQuality());
        return report;
    }

    /**
     * Missing sampling periods inside an interval: {@code round(duration / frequency) - 1},
     * at least 1 for any interval wide enough to be a gap.
     */
    static long missingPeriods(long durationMs, long frequencyMs) {
        long periods = Math.round((double) durationMs / frequencyMs);
        return Math.max(1L, periods - 1);
    }

    /**
     * Resolves the column holding timestamps. An index is materialized as an
     * ordinary column first so both layouts run through the same detection.
     */
    static Column timestampColumn(TimeSeriesTable table, TimestampField field) {
        if (field == null || !field.isFound()) {
            throw new GapRepairException(RepairErrorType.NO_TIMESTAMP_FIELD, "No timestamp column found");
        }
        if (field.kind() == TimestampField.Kind.INDEX) {
            if (!table.hasTimestampIndex()) {
                throw new GapRepairException(RepairErrorType.NO_TIMESTAMP_FIELD,
                    "Table has no timestamp index");
            }
            return table.materializeIndex().column(0);
        }
        if (!table.hasColumn(field.name())) {
            throw new GapRepairException(RepairErrorType.NO_TIMESTAMP_FIELD,
                "No timestamp column found: '" + field.name() + "'");
        }
        return table.column(field.name());
    }

    private GapReport emptyReport(DataQuality quality, TimeRange range, long totalRows, List<String> notes) {
        SamplingFrequency frequency = SamplingFrequency.DEFAULT;
        return new GapReport(
            false,
            0L,
            List.of(),
            frequency,
            Duration.ofMillis(Math.round(frequency.toMillis() * toleranceMultiplier)),
            quality,
            range,
            totalRows,
            notes
        );
    }
}
