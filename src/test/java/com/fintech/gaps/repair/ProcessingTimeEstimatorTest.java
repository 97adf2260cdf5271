package com.fintech.gaps.repair;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.DisplayName;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProcessingTimeEstimator Tests")
class ProcessingTimeEstimatorTest {

    private final ProcessingTimeEstimator estimator = new ProcessingTimeEstimator();

    @ParameterizedTest(name = "{0} rows, {1} gaps -> {2}")
    @CsvSource({
        "100000, 0, 1.0 seconds",
        "0, 500, 0.5 seconds",
        "10000000, 0, 1.7 minutes",
        "0, 4000000, 1.1 hours"
    })
    @DisplayName("Should format the estimate in the largest fitting unit")
    void testEstimate(long rows, long gaps, String expected) {
        assertThat(estimator.estimate(rows, gaps)).isEqualTo(expected);
    }
}
