package com.fintech.gaps.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * One detected gap: the interval between two consecutive observed samples that is
 * wider than the gap threshold.
 *
 * @param start timestamp of the last sample before the gap
 * @param end timestamp of the first sample after the gap
 * @param size number of sampling periods missing inside the interval (at least 1)
 * @param duration observed spacing, {@code end - start}
 */
public record Gap(
    Instant start,
    Instant end,
    long size,
    Duration duration
) {
}
