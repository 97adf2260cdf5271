package com.fintech.gaps.repair;

import com.fintech.gaps.detection.TimestampValues;
import com.fintech.gaps.domain.Column;
import com.fintech.gaps.domain.FieldRepairFailure;
import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.GapReport;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.RepairOutcome;
import com.fintech.gaps.domain.RepairResult;
import com.fintech.gaps.domain.RepairStrategy;
import com.fintech.gaps.domain.ResourceBudget;
import com.fintech.gaps.domain.SamplingFrequency;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampField;
import com.fintech.gaps.resource.ResourceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.IntStream;

/**
 * Applies a repair strategy to a table.
 *
 * <p>Execution model:
 * <ul>
 *   <li>The input table is copied, never modified</li>
 *   <li>Rows are sorted by timestamp when every timestamp parses</li>
 *   <li>Dispatch is an exhaustive switch over {@link RepairStrategy}</li>
 *   <li>Each field is repaired independently; a failing field is recorded as a
 *       {@link FieldRepairFailure} and left as it was</li>
 *   <li>Rows are only ever added, never removed</li>
 * </ul>
 *
 * <p>Memory: {@code linear} and {@code cubic} switch to {@code chunked} when the
 * estimated grid does not fit under the budget; the other grid strategies fail
 * with {@link RepairErrorType#INSUFFICIENT_MEMORY} instead.
 */
public class RepairEngine {

    private static final Logger log = LoggerFactory.getLogger(RepairEngine.class);

    /** Rough per-cell footprint of a boxed table cell. */
    static final int BYTES_PER_CELL = 24;

    private final ResourceGuard resourceGuard;
    private final RepairSettings settings;

    public RepairEngine(ResourceGuard resourceGuard, RepairSettings settings) {
        this.resourceGuard = resourceGuard;
        this.settings = settings;
    }

    /**
     * Repairs a table with an explicit strategy.
     *
     * @param table input, left untouched
     * @param field where the timestamps live
     * @param report detection report for {@code table}
     * @param strategy strategy to run
     * @param budget memory budget for grid strategies
     * @return repaired table and result; {@code gapsFixed} is taken from the report
     * @throws GapRepairException for missing timestamp fields, malformed timestamps
     *         under a grid strategy, or insufficient memory
     */
    public RepairOutcome repair(TimeSeriesTable table, TimestampField field, GapReport report,
                                RepairStrategy strategy, ResourceBudget budget) {
        long startNanos = System.nanoTime();
        double memoryBefore = resourceGuard.currentUsageMb();

        boolean indexed = field.kind() == TimestampField.Kind.INDEX;
        TimeSeriesTable work = indexed && table.hasTimestampIndex() ? table.materializeIndex() : table.copy();
        String keyName = indexed ? work.materializedIndexName() : field.name();
        if (!field.isFound() || keyName == null || !work.hasColumn(keyName)) {
            throw new GapRepairException(RepairErrorType.NO_TIMESTAMP_FIELD, "No timestamp column found");
        }
        int keyPos = work.columnIndex(keyName).getAsInt();

        Long[] parsed = TimestampValues.parse(work.column(keyPos));
        int unparseable = TimestampValues.countUnparseable(parsed);
        if (unparseable > 0 && strategy.buildsGrid()) {
            throw new GapRepairException(RepairErrorType.MALFORMED_TIMESTAMPS,
                unparseable + " rows have unparseable timestamps in '" + keyName
                    + "'; strategy '" + strategy.id() + "' needs every row on the time grid");
        }

        long[] timestamps = null;
        if (unparseable == 0) {
            timestamps = Arrays.stream(parsed).mapToLong(Long::longValue).toArray();
            int[] order = sortOrder(timestamps);
            if (order != null) {
                work = work.reorder(order);
                long[] unsorted = timestamps;
                timestamps = Arrays.stream(order).mapToLong(i -> unsorted[i]).toArray();
            }
        } else {
            log.warn("Keeping input row order: {} unparseable timestamps in '{}'", unparseable, keyName);
        }

        RepairRun run = new RepairRun(work, keyPos, timestamps, report.expectedFrequency(),
            report.gapThreshold(), strategy);

        Step step = switch (strategy) {
            case NONE -> new Step(work, RepairStrategy.NONE);
            case FORWARD_FILL -> new Step(
                run.fillInPlace(c -> FieldInterpolator.forwardFill(c, Integer.MAX_VALUE), false), strategy);
            case BACKWARD_FILL -> new Step(
                run.fillInPlace(c -> FieldInterpolator.backwardFill(c, Integer.MAX_VALUE), false), strategy);
            case INTERPOLATE -> new Step(run.fillInPlace(FieldInterpolator::byPosition, true), strategy);
            case LINEAR, CUBIC -> {
                resourceGuard.ensureHeadroom(budget);
                if (!resourceGuard.canAfford(budget, estimateGridMb(work, report))) {
                    log.warn("Grid for '{}' exceeds memory headroom, switching to chunked", strategy.id());
                    yield new Step(run.chunked(), RepairStrategy.CHUNKED);
                }
                boolean cubic = strategy == RepairStrategy.CUBIC;
                TimeSeriesTable interpolated = run.interpolated(cubic);
                yield new Step(interpolated,
                    cubic && (run.splineUsed || !run.splineSkipped) ? RepairStrategy.CUBIC : RepairStrategy.LINEAR);
            }
            case CHUNKED -> new Step(run.chunked(), strategy);
            case SEASONAL -> {
                resourceGuard.ensureHeadroom(budget, estimateGridMb(work, report));
                yield new Step(run.seasonal(), strategy);
            }
            case ML_FORECAST -> {
                resourceGuard.ensureHeadroom(budget, estimateGridMb(work, report));
                yield new Step(run.rollingForecast(), strategy);
            }
            case MEAN_FILL, MEDIAN_FILL -> {
                resourceGuard.ensureHeadroom(budget, estimateGridMb(work, report));
                yield new Step(run.statisticFill(strategy == RepairStrategy.MEDIAN_FILL), strategy);
            }
        };

        TimeSeriesTable repaired = step.table();
        RepairStrategy executed = step.executed();
        if (indexed) {
            repaired = repaired.restoreIndex();
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        RepairResult result = RepairResult.builder()
            .success(true)
            .gapsFixed(strategy == RepairStrategy.NONE ? 0 : report.gapCount())
            .requestedStrategy(strategy.id())
            .algorithmUsed(executed)
            .processingTime(elapsed)
            .memoryUsedMb(Math.max(0.0, resourceGuard.currentUsageMb() - memoryBefore))
            .rowsBefore(table.rowCount())
            .rowsAfter(repaired.rowCount())
            .diagnostics(run.diagnostics())
            .build();

        log.debug("Repair complete: strategy={}, executed={}, rows {} -> {}, diagnostics={}, elapsed={}ms",
                 strategy.id(), executed.id(), result.rowsBefore(), result.rowsAfter(),
                 result.diagnostics().size(), elapsed.toMillis());
        return new RepairOutcome(repaired, result);
    }

    /** Estimated size of the reindexed table in megabytes. */
    static double estimateGridMb(TimeSeriesTable table, GapReport report) {
        double cells = (double) (table.rowCount() + report.gapCount()) * Math.max(1, table.columnCount());
        return cells * BYTES_PER_CELL / (1024.0 * 1024.0);
    }

    /** Stable sort order, or null when the timestamps are already non-decreasing. */
    private static int[] sortOrder(long[] timestamps) {
        boolean sorted = true;
        for (int i = 1; i < timestamps.length && sorted; i++) {
            sorted = timestamps[i - 1] <= timestamps[i];
        }
        if (sorted) {
            return null;
        }
        return IntStream.range(0, timestamps.length)
            .boxed()
            .sorted(Comparator.comparingLong(i -> timestamps[i]))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    private record Step(TimeSeriesTable table, RepairStrategy executed) {
    }

    /**
     * State of one repair call: the sorted working copy plus the diagnostics
     * collected so far.
     */
    private final class RepairRun {

        private final TimeSeriesTable work;
        private final int keyPos;
        private final long[] timestamps;
        private final RepairStrategy strategy;
        private final TimeGrid grid;
        // one diagnostic per field; chunked windows would otherwise repeat them
        private final Map<String, FieldRepairFailure> failures = new LinkedHashMap<>();
        private boolean splineUsed;
        private boolean splineSkipped;

        RepairRun(TimeSeriesTable work, int keyPos, long[] timestamps, SamplingFrequency frequency,
                  Duration gapThreshold, RepairStrategy strategy) {
            this.work = work;
            this.keyPos = keyPos;
            this.timestamps = timestamps;
            this.strategy = strategy;
            this.grid = new TimeGrid(frequency, gapThreshold.toMillis());
        }

        List<FieldRepairFailure> diagnostics() {
            return new ArrayList<>(failures.values());
        }

        TimeSeriesTable fillInPlace(Consumer<Column> operation, boolean numericOnly) {
            for (int c = 0; c < work.columnCount(); c++) {
                Column column = work.column(c);
                if (c == keyPos || (numericOnly && !column.isNumeric())) {
                    continue;
                }
                applyToField(column, operation);
            }
            return work;
        }

        TimeSeriesTable interpolated(boolean spline) {
            TimeGrid.Reindexed reindexed = grid.reindex(work, keyPos, timestamps);
            interpolateFields(reindexed.table(), toDoubles(reindexed.timestamps()), spline);
            return reindexed.table();
        }

        TimeSeriesTable chunked() {
            int rows = work.rowCount();
            int chunkSize = settings.chunkSize();
            int overlap = settings.chunkOverlap();
            if (rows <= chunkSize) {
                return interpolated(false);
            }

            TimeSeriesTable out = work.emptyLike();
            int step = chunkSize - overlap;
            int windows = 0;
            for (int start = 0; ; start += step) {
                int end = Math.min(start + chunkSize, rows);
                int from = windowFrom(start, end);
                int to = windowTo(start, end);
                TimeGrid.Reindexed window = grid.reindex(
                    work.slice(from, to), keyPos, Arrays.copyOfRange(timestamps, from, to));
                interpolateFields(window.table(), toDoubles(window.timestamps()), false);

                // rows up to the last overlapping original row were emitted by the previous window
                int[] positions = window.originalPositions();
                int first = start == 0 ? 0 : positions[start + overlap - 1 - from] + 1;
                int last = end == rows ? window.table().rowCount() - 1 : positions[end - 1 - from];
                for (int row = first; row <= last; row++) {
                    out.appendRowFrom(window.table(), row);
                }
                windows++;
                if (end == rows) {
                    break;
                }
            }
            log.debug("Chunked repair: rows={}, windows={}, chunk_size={}, overlap={}",
                     rows, windows, chunkSize, overlap);
            return out;
        }

        /**
         * First row to interpolate for the window {@code [start, end)}: far enough back
         * that every field sees its last known value before the window.
         */
        private int windowFrom(int start, int end) {
            int from = start;
            for (int c = 0; c < work.columnCount(); c++) {
                if (c == keyPos) {
                    continue;
                }
                Column column = work.column(c);
                int previous = previousKnown(column, start);
                if (previous >= 0) {
                    from = Math.min(from, previous);
                    // a lone known value would be filled flat instead of interpolated
                    if (column.isNumeric() && knownBetween(column, previous, end) < 2 && nextKnown(column, end) < 0) {
                        int earlier = previousKnown(column, previous - 1);
                        if (earlier >= 0) {
                            from = Math.min(from, earlier);
                        }
                    }
                }
            }
            return from;
        }

        /** Row after the last one to interpolate: far enough on to reach every field's next known value. */
        private int windowTo(int start, int end) {
            int to = end;
            for (int c = 0; c < work.columnCount(); c++) {
                if (c == keyPos) {
                    continue;
                }
                Column column = work.column(c);
                int next = nextKnown(column, end - 1);
                if (next >= 0) {
                    to = Math.max(to, next + 1);
                    if (column.isNumeric() && knownBetween(column, start, next + 1) < 2 && previousKnown(column, start) < 0) {
                        int later = nextKnown(column, next + 1);
                        if (later >= 0) {
                            to = Math.max(to, later + 1);
                        }
                    }
                }
            }
            return to;
        }

        /** Last non-null row at or before {@code row}, or -1. */
        private int previousKnown(Column column, int row) {
            for (int i = Math.min(row, column.size() - 1); i >= 0; i--) {
                if (!column.isNull(i)) {
                    return i;
                }
            }
            return -1;
        }

        /** First non-null row at or after {@code row}, or -1. */
        private int nextKnown(Column column, int row) {
            for (int i = Math.max(row, 0); i < column.size(); i++) {
                if (!column.isNull(i)) {
                    return i;
                }
            }
            return -1;
        }

        private int knownBetween(Column column, int from, int to) {
            int known = 0;
            for (int i = from; i < to; i++) {
                if (!column.isNull(i)) {
                    known++;
                }
            }
            return known;
        }

        TimeSeriesTable seasonal() {
            TimeSeriesTable table = grid.reindex(work, keyPos, timestamps).table();
            int limit = settings.seasonalFillLimit();
            forEachField(table, column -> {
                FieldInterpolator.forwardFill(column, limit);
                FieldInterpolator.backwardFill(column, limit);
            }, false);
            return table;
        }

        TimeSeriesTable rollingForecast() {
            TimeSeriesTable table = grid.reindex(work, keyPos, timestamps).table();
            int window = Math.max(1, Math.min(settings.rollingWindowMax(), table.rowCount() / 4));
            forEachField(table, column -> {
                FieldInterpolator.rollingMean(column, window);
                // windows with no known value are bridged from their neighbours
                FieldInterpolator.forwardFill(column, Integer.MAX_VALUE);
                FieldInterpolator.backwardFill(column, Integer.MAX_VALUE);
            }, true);
            fillNonNumeric(table);
            return table;
        }

        TimeSeriesTable statisticFill(boolean median) {
            TimeSeriesTable table = grid.reindex(work, keyPos, timestamps).table();
            forEachField(table, column -> {
                double value = median ? FieldInterpolator.median(column) : FieldInterpolator.mean(column);
                if (Double.isNaN(value)) {
                    throw new IllegalStateException("no known values to take a "
                        + (median ? "median" : "mean") + " of");
                }
                FieldInterpolator.constant(column, value);
            }, true);
            fillNonNumeric(table);
            return table;
        }

        private void interpolateFields(TimeSeriesTable table, double[] x, boolean spline) {
            forEachField(table, column -> interpolateField(column, x, spline), true);
            fillNonNumeric(table);
        }

        private void interpolateField(Column column, double[] x, boolean spline) {
            int known = FieldInterpolator.knownCount(column);
            if (known == column.size()) {
                return;
            }
            if (known < FieldInterpolator.MIN_LINEAR_POINTS) {
                FieldInterpolator.forwardFill(column, Integer.MAX_VALUE);
                FieldInterpolator.backwardFill(column, Integer.MAX_VALUE);
                record(column, "only " + known + " known value(s), filled from neighbours instead of interpolating");
                return;
            }
            if (spline && known >= FieldInterpolator.MIN_SPLINE_POINTS) {
                FieldInterpolator.spline(column, x);
                splineUsed = true;
                return;
            }
            if (spline) {
                splineSkipped = true;
                record(column, "only " + known + " known values, cubic spline needs "
                    + FieldInterpolator.MIN_SPLINE_POINTS + "; used linear");
                log.warn("Cubic fallback to linear: field={}, known_points={}", column.name(), known);
            }
            FieldInterpolator.linear(column, x);
        }

        private void fillNonNumeric(TimeSeriesTable table) {
            forEachField(table, column -> {
                if (!column.isNumeric()) {
                    FieldInterpolator.forwardFill(column, Integer.MAX_VALUE);
                }
            }, false);
        }

        private void forEachField(TimeSeriesTable table, Consumer<Column> operation, boolean numericOnly) {
            for (int c = 0; c < table.columnCount(); c++) {
                Column column = table.column(c);
                if (c == keyPos || (numericOnly && !column.isNumeric())) {
                    continue;
                }
                applyToField(column, operation);
            }
        }

        private void applyToField(Column column, Consumer<Column> operation) {
            try {
                operation.accept(column);
                if (log.isTraceEnabled()) {
                    log.trace("Field repaired: field={}, strategy={}, nulls_left={}",
                             column.name(), strategy.id(), column.nullCount());
                }
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                record(column, message);
                log.warn("Field repair failed, leaving field unmodified: field={}, strategy={}, error={}",
                        column.name(), strategy.id(), message);
            }
        }

        private void record(Column column, String message) {
            failures.putIfAbsent(column.name(), new FieldRepairFailure(column.name(), strategy, message));
        }

        private double[] toDoubles(long[] values) {
            double[] out = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                out[i] = values[i];
            }
            return out;
        }
    }
}
