package com.fintech.gaps.domain;

import java.time.Duration;
import java.util.List;

/**
 * Result of one gap detection pass. Immutable; a new report is produced per call.
 *
 * @param hasGaps true if at least one missing period was found
 * @param gapCount total missing periods; a gap spanning k missing periods adds k
 * @param gapDetails one entry per detected gap, in time order
 * @param expectedFrequency inferred nominal sampling frequency
 * @param gapThreshold spacing above which an interval is a gap
 * @param dataQuality completeness grade
 * @param timeRange first and last parsed timestamp; null when no timestamp parsed
 * @param totalRows rows in the analysed table
 * @param notes diagnostic notes (dropped rows, unparseable timestamps)
 */
public record GapReport(
    boolean hasGaps,
    long gapCount,
    List<Gap> gapDetails,
    SamplingFrequency expectedFrequency,
    Duration gapThreshold,
    DataQuality dataQuality,
    TimeRange timeRange,
    long totalRows,
    List<String> notes
) {

    public GapReport {
        gapDetails = List.copyOf(gapDetails);
        notes = List.copyOf(notes);
    }

    /** Mean missing periods per gap event, 0 when there are no gaps. */
    public double averageGapSize() {
        if (gapDetails.isEmpty()) {
            return 0.0;
        }
        return (double) gapDetails.stream().mapToLong(Gap::size).sum() / gapDetails.size();
    }

    /** Largest single gap in missing periods, 0 when there are no gaps. */
    public long largestGapSize() {
        return gapDetails.stream().mapToLong(Gap::size).max().orElse(0L);
    }
}
