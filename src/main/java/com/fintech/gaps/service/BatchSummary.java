package com.fintech.gaps.service;

import com.fintech.gaps.domain.RepairResult;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate outcome of one batch run.
 *
 * @param results one result per input file, in input order
 * @param filesProcessed files attempted
 * @param succeeded files whose result is a success
 * @param failed files whose result is a failure
 * @param totalGapsFixed sum of {@code gapsFixed} over successful files
 * @param elapsed wall-clock time of the whole batch
 */
public record BatchSummary(
    List<RepairResult> results,
    int filesProcessed,
    int succeeded,
    int failed,
    long totalGapsFixed,
    Duration elapsed
) {

    public BatchSummary {
        results = List.copyOf(results);
    }

    public static BatchSummary of(List<RepairResult> results, Duration elapsed) {
        int succeeded = (int) results.stream().filter(RepairResult::success).count();
        long gaps = results.stream()
            .filter(RepairResult::success)
            .mapToLong(RepairResult::gapsFixed)
            .sum();
        return new BatchSummary(results, results.size(), succeeded, results.size() - succeeded, gaps, elapsed);
    }
}
