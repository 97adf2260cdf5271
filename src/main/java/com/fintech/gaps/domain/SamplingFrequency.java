package com.fintech.gaps.domain;

import java.time.Duration;

/**
 * Canonical sampling frequencies a time series can be snapped to.
 * Ordered from finest to coarsest; frequency inference relies on that order.
 */
public enum SamplingFrequency {

    M1(60_000L),
    M5(300_000L),
    M15(900_000L),
    H1(3_600_000L),
    H4(14_400_000L),
    D1(86_400_000L),
    W1(604_800_000L);

    /** Used when a series is too short to infer anything from. */
    public static final SamplingFrequency DEFAULT = H1;

    private final long milliseconds;

    SamplingFrequency(long milliseconds) {
        this.milliseconds = milliseconds;
    }

    /** Returns frequency duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /** Returns frequency as a {@link Duration}. */
    public Duration toDuration() {
        return Duration.ofMillis(milliseconds);
    }

    /**
     * Snaps an observed spacing to the smallest canonical frequency that is
     * greater than or equal to it. Spacings coarser than a week snap to {@link #W1}.
     *
     * @param spacingMillis observed spacing between samples
     * @return canonical frequency
     */
    public static SamplingFrequency snap(double spacingMillis) {
        for (SamplingFrequency frequency : values()) {
            if (spacingMillis <= frequency.milliseconds) {
                return frequency;
            }
        }
        return W1;
    }

    /**
     * Aligns timestamp to the frequency boundary: (timestamp / frequencyMs) * frequencyMs.
     */
    public long alignTimestamp(long timestamp) {
        return Math.floorDiv(timestamp, milliseconds) * milliseconds;
    }

    /** Returns true if the timestamp sits exactly on a frequency boundary. */
    public boolean isAligned(long timestamp) {
        return alignTimestamp(timestamp) == timestamp;
    }
}
