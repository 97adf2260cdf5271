package com.fintech.gaps.detection;

import com.fintech.gaps.domain.SamplingFrequency;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the nominal sampling frequency of a series.
 *
 * <p>Takes the median of successive differences, so a handful of large gaps
 * cannot drag the estimate upward, then snaps it to the canonical frequency ladder.
 *
 * <p>Stateless and thread-safe.
 */
public class FrequencyInferencer {

    private static final Logger log = LoggerFactory.getLogger(FrequencyInferencer.class);

    /**
     * Infers the sampling frequency of timestamps sorted ascending.
     * Fewer than two timestamps yield {@link SamplingFrequency#DEFAULT}.
     *
     * @param sortedTimestamps epoch millis, ascending
     * @return canonical frequency
     */
    public SamplingFrequency infer(long[] sortedTimestamps) {
        if (sortedTimestamps == null || sortedTimestamps.length < 2) {
            return SamplingFrequency.DEFAULT;
        }

        double[] diffs = new double[sortedTimestamps.length - 1];
        for (int i = 1; i < sortedTimestamps.length; i++) {
            diffs[i - 1] = sortedTimestamps[i] - sortedTimestamps[i - 1];
        }

        double median = medianOf(diffs);
        SamplingFrequency frequency = SamplingFrequency.snap(median);

        if (log.isDebugEnabled()) {
            log.debug("Inferred frequency: samples={}, median_diff={}ms, frequency={}",
                     sortedTimestamps.length, median, frequency);
        }
        return frequency;
    }

    /** Median with linear interpolation between the two middle values for even counts. */
    static double medianOf(double[] values) {
        Percentile median = new Percentile(50d).withEstimationType(EstimationType.R_7);
        return median.evaluate(values);
    }
}
