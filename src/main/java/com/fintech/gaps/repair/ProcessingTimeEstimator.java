package com.fintech.gaps.repair;

import java.util.Locale;

/**
 * Rough wall-clock estimate for a repair, logged before the repair starts.
 * Purely informational; nothing downstream depends on its accuracy.
 */
public class ProcessingTimeEstimator {

    static final double SECONDS_PER_ROW = 1e-5;
    static final double SECONDS_PER_GAP = 1e-3;

    /**
     * @param rows rows in the table
     * @param gaps missing periods reported by detection
     * @return e.g. "0.1 seconds", "2.5 minutes", "1.2 hours"
     */
    public String estimate(long rows, long gaps) {
        double seconds = Math.max(0, rows) * SECONDS_PER_ROW + Math.max(0, gaps) * SECONDS_PER_GAP;
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1f seconds", seconds);
        }
        if (seconds < 3600) {
            return String.format(Locale.ROOT, "%.1f minutes", seconds / 60);
        }
        return String.format(Locale.ROOT, "%.1f hours", seconds / 3600);
    }
}
