package com.fintech.gaps.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed time range covered by a series.
 *
 * @param start earliest timestamp
 * @param end latest timestamp
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public static TimeRange ofEpochMillis(long start, long end) {
        return new TimeRange(Instant.ofEpochMilli(start), Instant.ofEpochMilli(end));
    }

    public Duration span() {
        return Duration.between(start, end);
    }
}
