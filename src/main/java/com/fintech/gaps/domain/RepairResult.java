package com.fintech.gaps.domain;

import lombok.Builder;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of repairing one table or file.
 *
 * @param path file the result belongs to; null for in-memory repairs
 * @param success false if the operation failed fatally
 * @param gapsFixed missing periods repaired, taken from the detection report
 * @param requestedStrategy strategy id the caller asked for, possibly "auto"
 * @param algorithmUsed strategy actually executed; may differ from the request
 * @param processingTime wall-clock time spent
 * @param memoryUsedMb process memory growth observed during the repair
 * @param rowsBefore rows in the input table
 * @param rowsAfter rows in the repaired table
 * @param backupPath snapshot taken before the file was overwritten
 * @param errorType failure category when {@code success} is false
 * @param error failure message when {@code success} is false
 * @param diagnostics non-fatal per-field failures
 */
@Builder(toBuilder = true)
public record RepairResult(
    Path path,
    boolean success,
    long gapsFixed,
    String requestedStrategy,
    RepairStrategy algorithmUsed,
    Duration processingTime,
    double memoryUsedMb,
    long rowsBefore,
    long rowsAfter,
    Path backupPath,
    RepairErrorType errorType,
    String error,
    List<FieldRepairFailure> diagnostics
) {

    public RepairResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        processingTime = processingTime == null ? Duration.ZERO : processingTime;
    }

    public static RepairResult failure(Path path, RepairErrorType errorType, String error) {
        return RepairResult.builder()
            .path(path)
            .success(false)
            .errorType(errorType)
            .error(error)
            .build();
    }

    public Optional<Path> backup() {
        return Optional.ofNullable(backupPath);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    /** Rows inserted for missing time slots. */
    public long pointsAdded() {
        return rowsAfter - rowsBefore;
    }
}
