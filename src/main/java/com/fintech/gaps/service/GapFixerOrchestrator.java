package com.fintech.gaps.service;

import com.fintech.gaps.detection.GapDetector;
import com.fintech.gaps.detection.TimestampColumnLocator;
import com.fintech.gaps.domain.BackupRecord;
import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.GapReport;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.RepairOutcome;
import com.fintech.gaps.domain.RepairResult;
import com.fintech.gaps.domain.RepairStrategy;
import com.fintech.gaps.domain.ResourceBudget;
import com.fintech.gaps.domain.TimeSeriesTable;
import com.fintech.gaps.domain.TimestampField;
import com.fintech.gaps.repair.ProcessingTimeEstimator;
import com.fintech.gaps.repair.RepairEngine;
import com.fintech.gaps.repair.StrategySelector;
import com.fintech.gaps.resource.ResourceGuard;
import com.fintech.gaps.storage.BackupStore;
import com.fintech.gaps.storage.TableStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one file, or a batch of files, through load, detect, repair, backup and save.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Per-file state machine ({@link OrchestratorState})</li>
 *   <li>Turning every failure into a failed {@link RepairResult}; nothing thrown escapes a file</li>
 *   <li>Sequential batches with unconditional memory cleanup after each file</li>
 *   <li>Metrics and lifecycle logging</li>
 * </ul>
 *
 * <p>Not thread-safe. One orchestrator processes one file at a time.
 */
public class GapFixerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GapFixerOrchestrator.class);

    private final TableStore tableStore;
    private final BackupStore backupStore;
    private final TimestampColumnLocator timestampLocator;
    private final GapDetector gapDetector;
    private final StrategySelector strategySelector;
    private final RepairEngine repairEngine;
    private final ResourceGuard resourceGuard;
    private final ProcessingTimeEstimator timeEstimator;
    private final Policy policy;
    private final MeterRegistry meterRegistry;

    private final AtomicLong filesProcessed = new AtomicLong(0);
    private final AtomicLong filesFailed = new AtomicLong(0);
    private final AtomicLong gapsFixed = new AtomicLong(0);

    private OrchestratorState state = OrchestratorState.IDLE;
    private final List<OrchestratorState> transitions = new ArrayList<>();

    /**
     * Settings fixed at construction.
     *
     * @param budget process-wide memory budget
     * @param backupRequired true to fail a file whose backup cannot be created
     * @param defaultStrategy strategy id used when a caller passes none
     */
    public record Policy(ResourceBudget budget, boolean backupRequired, String defaultStrategy) {
    }

    public GapFixerOrchestrator(
            TableStore tableStore,
            BackupStore backupStore,
            TimestampColumnLocator timestampLocator,
            GapDetector gapDetector,
            StrategySelector strategySelector,
            RepairEngine repairEngine,
            ResourceGuard resourceGuard,
            ProcessingTimeEstimator timeEstimator,
            Policy policy,
            MeterRegistry meterRegistry) {
        this.tableStore = tableStore;
        this.backupStore = backupStore;
        this.timestampLocator = timestampLocator;
        this.gapDetector = gapDetector;
        this.strategySelector = strategySelector;
        this.repairEngine = repairEngine;
        this.resourceGuard = resourceGuard;
        this.timeEstimator = timeEstimator;
        this.policy = policy;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("gap.repair.files.processed", filesProcessed);
        meterRegistry.gauge("gap.repair.files.failed", filesFailed);
        meterRegistry.gauge("gap.repair.gaps.fixed", gapsFixed);
    }

    /**
     * Repairs one file in place.
     *
     * @param path parquet, csv or json file
     * @param strategyId strategy id, {@code auto}, or null for the configured default
     * @return repaired table (null if the file never loaded) and the file's result
     */
    public RepairOutcome repairFile(Path path, String strategyId) {
        String requested = strategyId != null ? strategyId : policy.defaultStrategy();
        Timer.Sample sample = Timer.start(meterRegistry);
        long startNanos = System.nanoTime();
        begin();
        TimeSeriesTable table = null;

        try {
            table = tableStore.load(path);
            transition(OrchestratorState.LOADED);
            log.info("Loaded {}: rows={}, columns={}", path.getFileName(), table.rowCount(), table.columnCount());

            TimestampField field = locate(table);
            GapReport report = gapDetector.detect(table, field);
            transition(OrchestratorState.DETECTED);
            log.info("Detected {}: gaps={}, missing={}, frequency={}, quality={}",
                    path.getFileName(), report.gapDetails().size(), report.gapCount(),
                    report.expectedFrequency(), report.dataQuality());

            if (!report.hasGaps()) {
                transition(OrchestratorState.NO_GAPS_FOUND);
                RepairResult result = RepairResult.builder()
                    .path(path)
                    .success(true)
                    .gapsFixed(0)
                    .requestedStrategy(requested)
                    .algorithmUsed(RepairStrategy.NONE)
                    .processingTime(elapsedSince(startNanos))
                    .rowsBefore(table.rowCount())
                    .rowsAfter(table.rowCount())
                    .build();
                transition(OrchestratorState.IDLE);
                return succeeded(table, result);
            }

            transition(OrchestratorState.REPAIRING);
            RepairOutcome repaired = repair(table, field, report, requested);
            RepairResult.RepairResultBuilder result = repaired.result().toBuilder()
                .path(path)
                .requestedStrategy(requested);

            if (repaired.result().algorithmUsed() == RepairStrategy.NONE) {
                transition(OrchestratorState.IDLE);
                return succeeded(repaired.table(), result.processingTime(elapsedSince(startNanos)).build());
            }

            BackupRecord backup = backup(path);
            result.backupPath(backup != null ? backup.backupPath() : null);

            try {
                tableStore.save(repaired.table(), path);
            } catch (GapRepairException e) {
                transition(OrchestratorState.ERROR);
                filesFailed.incrementAndGet();
                log.error("Write failed, original file unchanged: {}: {}", path, e.getMessage());
                // the repaired table still goes back to the caller
                return new RepairOutcome(repaired.table(), result
                    .success(false)
                    .errorType(e.getErrorType())
                    .error(e.getMessage())
                    .processingTime(elapsedSince(startNanos))
                    .build());
            }
            transition(OrchestratorState.SAVED);

            RepairResult saved = result.processingTime(elapsedSince(startNanos)).build();
            gapsFixed.addAndGet(saved.gapsFixed());
            log.info("Saved {}: strategy={}, gaps_fixed={}, rows {} -> {}, elapsed={}ms",
                    path.getFileName(), saved.algorithmUsed().id(), saved.gapsFixed(),
                    saved.rowsBefore(), saved.rowsAfter(), saved.processingTime().toMillis());
            transition(OrchestratorState.IDLE);
            return succeeded(repaired.table(), saved);

        } catch (GapRepairException e) {
            return failed(path, table, e.getErrorType(), e.getMessage(), e);
        } catch (RuntimeException e) {
            return failed(path, table, RepairErrorType.INTERNAL_ERROR,
                "Unexpected error: " + e.getMessage(), e);
        } finally {
            filesProcessed.incrementAndGet();
            sample.stop(meterRegistry.timer("gap.repair.file.processing.time"));
        }
    }

    /**
     * Repairs a table in memory, without touching any file.
     *
     * @param table input, left untouched
     * @param timestampField timestamp column or index name; null to locate it automatically
     * @param strategyId strategy id, {@code auto}, or null for the configured default
     */
    public RepairOutcome repairTable(TimeSeriesTable table, String timestampField, String strategyId) {
        String requested = strategyId != null ? strategyId : policy.defaultStrategy();
        long startNanos = System.nanoTime();
        begin();
        try {
            transition(OrchestratorState.LOADED);
            TimestampField field = timestampField == null ? locate(table) : resolveField(table, timestampField);
            GapReport report = gapDetector.detect(table, field);
            transition(OrchestratorState.DETECTED);

            if (!report.hasGaps()) {
                transition(OrchestratorState.NO_GAPS_FOUND);
                transition(OrchestratorState.IDLE);
                return new RepairOutcome(table.copy(), RepairResult.builder()
                    .success(true)
                    .requestedStrategy(requested)
                    .algorithmUsed(RepairStrategy.NONE)
                    .processingTime(elapsedSince(startNanos))
                    .rowsBefore(table.rowCount())
                    .rowsAfter(table.rowCount())
                    .build());
            }

            transition(OrchestratorState.REPAIRING);
            RepairOutcome repaired = repair(table, field, report, requested);
            transition(OrchestratorState.IDLE);
            return new RepairOutcome(repaired.table(), repaired.result().toBuilder()
                .requestedStrategy(requested)
                .processingTime(elapsedSince(startNanos))
                .build());

        } catch (GapRepairException e) {
            transition(OrchestratorState.ERROR);
            log.error("In-memory repair failed: {}", e.getMessage());
            return new RepairOutcome(table.copy(), RepairResult.failure(null, e.getErrorType(), e.getMessage()));
        } catch (RuntimeException e) {
            transition(OrchestratorState.ERROR);
            log.error("In-memory repair failed unexpectedly", e);
            return new RepairOutcome(table.copy(),
                RepairResult.failure(null, RepairErrorType.INTERNAL_ERROR, "Unexpected error: " + e.getMessage()));
        }
    }

    /**
     * Repairs files one after another, in the order given. A failing file never
     * stops the batch; memory is reclaimed after every file.
     *
     * @param showProgress log a progress line per file
     */
    public BatchSummary repairBatch(List<Path> paths, String strategyId, boolean showProgress) {
        long startNanos = System.nanoTime();
        List<RepairResult> results = new ArrayList<>(paths.size());
        log.info("Batch started: files={}, strategy={}", paths.size(),
                strategyId != null ? strategyId : policy.defaultStrategy());

        for (int i = 0; i < paths.size(); i++) {
            Path path = paths.get(i);
            if (showProgress) {
                log.info("[{}/{}] {}", i + 1, paths.size(), path);
            }
            try {
                results.add(repairFile(path, strategyId).result());
            } finally {
                resourceGuard.cleanup();
            }
        }

        BatchSummary summary = BatchSummary.of(results, elapsedSince(startNanos));
        log.info("Batch finished: processed={}, succeeded={}, failed={}, gaps_fixed={}, elapsed={}ms",
                summary.filesProcessed(), summary.succeeded(), summary.failed(),
                summary.totalGapsFixed(), summary.elapsed().toMillis());
        return summary;
    }

    public OrchestratorState state() {
        return state;
    }

    /** States visited while handling the most recent file or table, in order. */
    public List<OrchestratorState> lastTransitions() {
        return Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public long getFilesProcessed() {
        return filesProcessed.get();
    }

    public long getFilesFailed() {
        return filesFailed.get();
    }

    public long getGapsFixed() {
        return gapsFixed.get();
    }

    private RepairOutcome repair(TimeSeriesTable table, TimestampField field, GapReport report, String requested) {
        RepairStrategy strategy = strategySelector.resolve(requested, report);
        resourceGuard.ensureHeadroom(policy.budget());
        log.info("Repairing with strategy={} (requested {}), estimated {}",
                strategy.id(), requested, timeEstimator.estimate(table.rowCount(), report.gapCount()));
        RepairOutcome outcome = repairEngine.repair(table, field, report, strategy, policy.budget());
        outcome.result().diagnostics()
            .forEach(d -> log.warn("Field diagnostic: {}", d));
        return outcome;
    }

    private TimestampField locate(TimeSeriesTable table) {
        TimestampField field = timestampLocator.locate(table);
        if (!field.isFound()) {
            throw new GapRepairException(RepairErrorType.NO_TIMESTAMP_FIELD, "No timestamp column found");
        }
        log.debug("Timestamp field: kind={}, name={}", field.kind(), field.name());
        return field;
    }

    private static TimestampField resolveField(TimeSeriesTable table, String name) {
        if (table.hasColumn(name)) {
            return TimestampField.column(name);
        }
        if (table.hasTimestampIndex() && name.equals(table.index().name())) {
            return TimestampField.index(name);
        }
        throw new GapRepairException(RepairErrorType.NO_TIMESTAMP_FIELD, "No timestamp column found: '" + name + "'");
    }

    private BackupRecord backup(Path path) {
        try {
            return backupStore.backup(path);
        } catch (GapRepairException e) {
            if (policy.backupRequired()) {
                throw e;
            }
            log.warn("Backup failed, continuing without one: {}", e.getMessage());
            return null;
        }
    }

    private RepairOutcome succeeded(TimeSeriesTable table, RepairResult result) {
        return new RepairOutcome(table, result);
    }

    private RepairOutcome failed(Path path, TimeSeriesTable table, RepairErrorType type, String message,
                                 RuntimeException cause) {
        transition(OrchestratorState.ERROR);
        filesFailed.incrementAndGet();
        if (type == RepairErrorType.INTERNAL_ERROR) {
            log.error("Failed {}: {}", path, message, cause);
        } else {
            log.error("Failed {}: [{}] {}", path, type, message);
        }
        return new RepairOutcome(table, RepairResult.failure(path, type, message));
    }

    private void begin() {
        transitions.clear();
        state = OrchestratorState.IDLE;
        transitions.add(state);
    }

    private void transition(OrchestratorState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        log.debug("State {} -> {}", state, next);
        state = next;
        transitions.add(next);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
