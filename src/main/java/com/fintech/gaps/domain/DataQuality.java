package com.fintech.gaps.domain;

/**
 * Coarse completeness grade derived from the ratio of missing periods to rows.
 */
public enum DataQuality {

    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    /**
     * Grades a series: no gaps is excellent, up to 1% good, up to 5% fair, else poor.
     *
     * @param gapCount missing periods
     * @param totalRows rows the ratio is taken against
     */
    public static DataQuality fromGapRatio(long gapCount, long totalRows) {
        if (gapCount <= 0) {
            return EXCELLENT;
        }
        if (totalRows <= 0) {
            return POOR;
        }
        double ratio = (double) gapCount / totalRows;
        if (ratio <= 0.01) {
            return GOOD;
        }
        if (ratio <= 0.05) {
            return FAIR;
        }
        return POOR;
    }
}
