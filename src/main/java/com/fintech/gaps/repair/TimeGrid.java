package com.fintech.gaps.repair;

import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.ColumnType;
import com.fintech.gaps.domain.SamplingFrequency;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places missing sampling periods onto a regular time grid.
 *
 * <p>Slots are inserted only inside intervals wider than the gap threshold, at
 * {@code prev + k * frequency} while the slot lies more than half a period before
 * the next observed sample. Observed rows are always kept, including rows that
 * sit off the grid, so every interval after reindexing is at most
 * {@code 1.5 * frequency}.
 *
 * <p>Thread-safe and stateless apart from its configuration.
 */
public class TimeGrid {

    private static final Logger log = LoggerFactory.getLogger(TimeGrid.class);

    private final SamplingFrequency frequency;
    private final long thresholdMs;

    public TimeGrid(SamplingFrequency frequency, long thresholdMs) {
        this.frequency = frequency;
        this.thresholdMs = thresholdMs;
    }

    public SamplingFrequency frequency() {
        return frequency;
    }

    /** True if the interval between two samples is wide enough to be a gap. */
    public boolean isGap(long previous, long next) {
        return next - previous > thresholdMs;
    }

    /**
     * Number of slots {@link #missingPeriodsBetween(long, long)} would insert.
     *
     * @param previous last sample before the interval
     * @param next first sample after the interval
     */
    public int pointsToInsert(long previous, long next) {
        if (!isGap(previous, next)) {
            return 0;
        }
        long step = frequency.toMillis();
        double halfStep = step / 2.0;
        int count = 0;
        for (long t = previous + step; next - t > halfStep; t += step) {
            count++;
        }
        return count;
    }

    /**
     * Timestamps of the slots missing between two samples.
     *
     * @return epoch millis ascending; empty when the interval is not a gap
     */
    public long[] missingPeriodsBetween(long previous, long next) {
        long[] slots = new long[pointsToInsert(previous, next)];
        long step = frequency.toMillis();
        for (int k = 0; k < slots.length; k++) {
            slots[k] = previous + (k + 1) * step;
        }
        return slots;
    }

    /**
     * Builds a new table with an empty row for every missing slot. The input must
     * be sorted by timestamp and is not modified.
     *
     * @param sorted rows in timestamp order
     * @param timestampColumn position of the timestamp column
     * @param timestamps parsed timestamps, one per row of {@code sorted}
     */
    public Reindexed reindex(TimeSeriesTable sorted, int timestampColumn, long[] timestamps) {
        int rows = sorted.rowCount();
        int inserted = 0;
        for (int i = 1; i < rows; i++) {
            inserted += pointsToInsert(timestamps[i - 1], timestamps[i]);
        }

        TimeSeriesTable out = sorted.emptyLike();
        long[] outTimestamps = new long[rows + inserted];
        int[] originalPositions = new int[rows];
        Column keyColumn = sorted.column(timestampColumn);
        int position = 0;

        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                for (long slot : missingPeriodsBetween(timestamps[i - 1], timestamps[i])) {
                    out.appendEmptyRow();
                    out.column(timestampColumn).set(position, timestampCell(keyColumn, slot));
                    outTimestamps[position++] = slot;
                }
            }
            out.appendRowFrom(sorted, i);
            originalPositions[i] = position;
            outTimestamps[position++] = timestamps[i];
        }

        if (log.isDebugEnabled()) {
            log.debug("Reindexed onto {} grid: rows={}, inserted={}", frequency, rows, inserted);
        }
        return new Reindexed(out, outTimestamps, originalPositions);
    }

    /** Renders a slot timestamp in the representation the key column already uses. */
    static Object timestampCell(Column keyColumn, long epochMillis) {
        ColumnType type = keyColumn.type();
        return switch (type) {
            case TIMESTAMP, LONG -> epochMillis;
            case DOUBLE -> (double) epochMillis;
            case STRING -> formatFor(keyColumn).format(epochMillis);
            case BOOLEAN -> throw new IllegalStateException(
                "Column '" + keyColumn.name() + "' of type BOOLEAN cannot hold timestamps");
        };
    }

    private static TimestampFormat formatFor(Column keyColumn) {
        if (keyColumn.timestampFormat() != null) {
            return keyColumn.timestampFormat();
        }
        for (Object value : keyColumn.values()) {
            if (value != null) {
                TimestampFormat detected = TimestampFormat.detect(value.toString());
                if (detected != null) {
                    return detected;
                }
            }
        }
        return TimestampFormat.ISO_INSTANT;
    }

    /**
     * A reindexed table.
     *
     * @param table rows in timestamp order, inserted rows null except for the timestamp
     * @param timestamps epoch millis per row of {@code table}
     * @param originalPositions row of {@code table} holding each input row
     */
    public record Reindexed(TimeSeriesTable table, long[] timestamps, int[] originalPositions) {

        public int insertedRows() {
            return timestamps.length - originalPositions.length;
        }
    }
}
