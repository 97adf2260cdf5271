package com.fintech.gaps.domain;

/**
 * A repair result together with the table it produced.
 *
 * @param table repaired table; the untouched input when nothing was repaired;
 *              null when the input could not be loaded
 * @param result what happened
 */
public record RepairOutcome(TimeSeriesTable table, RepairResult result) {
}
