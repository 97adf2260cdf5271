package com.fintech.gaps.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SamplingFrequency Tests")
class SamplingFrequencyTest {

    @ParameterizedTest(name = "{0}ms snaps to {1}")
    @MethodSource("snapProvider")
    @DisplayName("Should snap to the smallest ladder value >= the spacing")
    void testSnap(double spacingMillis, SamplingFrequency expected) {
        assertThat(SamplingFrequency.snap(spacingMillis)).isEqualTo(expected);
    }

    static Stream<Arguments> snapProvider() {
        return Stream.of(
            Arguments.of(1_000d, SamplingFrequency.M1),
            Arguments.of(60_000d, SamplingFrequency.M1),
            Arguments.of(60_001d, SamplingFrequency.M5),
            Arguments.of(180_000d, SamplingFrequency.M5),
            Arguments.of(600_000d, SamplingFrequency.M15),
            Arguments.of(3_600_000d, SamplingFrequency.H1),
            Arguments.of(7_200_000d, SamplingFrequency.H4),
            Arguments.of(43_200_000d, SamplingFrequency.D1),
            Arguments.of(172_800_000d, SamplingFrequency.W1),
            Arguments.of(1_209_600_000d, SamplingFrequency.W1)
        );
    }

    @Test
    @DisplayName("Default frequency should be one hour")
    void testDefault() {
        assertThat(SamplingFrequency.DEFAULT).isEqualTo(SamplingFrequency.H1);
        assertThat(SamplingFrequency.DEFAULT.toDuration().toHours()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should align timestamps to frequency boundaries")
    void testAlignment() {
        long tenThirtySeven = 10 * 3_600_000L + 37 * 60_000L + 23_456L;

        assertThat(SamplingFrequency.H1.alignTimestamp(tenThirtySeven)).isEqualTo(10 * 3_600_000L);
        assertThat(SamplingFrequency.M15.alignTimestamp(tenThirtySeven)).isEqualTo(10 * 3_600_000L + 30 * 60_000L);
        assertThat(SamplingFrequency.H1.isAligned(10 * 3_600_000L)).isTrue();
        assertThat(SamplingFrequency.H1.isAligned(tenThirtySeven)).isFalse();
    }
}
