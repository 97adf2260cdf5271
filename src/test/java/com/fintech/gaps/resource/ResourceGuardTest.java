package com.fintech.gaps.resource;

import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.ResourceBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ResourceGuard}.
 *
 * Test Strategy:
 * - Headroom line at limit * ratio
 * - Exactly one reclamation pass before giving up
 * - Unconditional cleanup
 */
@DisplayName("ResourceGuard Tests")
class ResourceGuardTest {

    private MemoryProbe probe;
    private ResourceGuard guard;

    @BeforeEach
    void setUp() {
        probe = mock(MemoryProbe.class);
        guard = new ResourceGuard(probe);
    }

    @Test
    @DisplayName("Should report no headroom after one reclamation when usage exceeds the budget")
    void testOverBudget() {
        when(probe.usedMb()).thenReturn(10.0);

        assertThat(guard.available(new ResourceBudget(1))).isFalse();
        verify(probe, times(1)).reclaim();
    }

    @Test
    @DisplayName("Should not reclaim while under the headroom line")
    void testUnderBudget() {
        when(probe.usedMb()).thenReturn(500.0);

        assertThat(guard.available(new ResourceBudget(1000))).isTrue();
        verify(probe, never()).reclaim();
    }

    @Test
    @DisplayName("Should succeed when reclamation frees enough memory")
    void testReclaimRecovers() {
        when(probe.usedMb()).thenReturn(900.0, 100.0);

        assertThat(guard.available(new ResourceBudget(1000))).isTrue();
        verify(probe, times(1)).reclaim();
    }

    @Test
    @DisplayName("Should account for the planned allocation")
    void testCanAfford() {
        when(probe.usedMb()).thenReturn(500.0);
        ResourceBudget budget = new ResourceBudget(1000);

        assertThat(guard.canAfford(budget, 250)).isTrue();
        assertThat(guard.canAfford(budget, 350)).isFalse();
    }

    @Test
    @DisplayName("ensureHeadroom should throw INSUFFICIENT_MEMORY")
    void testEnsureHeadroom() {
        when(probe.usedMb()).thenReturn(10.0);

        assertThatThrownBy(() -> guard.ensureHeadroom(new ResourceBudget(1)))
            .isInstanceOf(GapRepairException.class)
            .hasFieldOrPropertyWithValue("errorType", RepairErrorType.INSUFFICIENT_MEMORY)
            .hasMessageContaining("limit 1 MB");
    }

    @Test
    @DisplayName("Cleanup should always reclaim")
    void testCleanup() {
        when(probe.usedMb()).thenReturn(1.0);

        guard.cleanup();
        guard.cleanup();

        verify(probe, times(2)).reclaim();
    }

    @Test
    @DisplayName("Should reject headroom ratios outside (0, 1]")
    void testRatioValidation() {
        assertThatThrownBy(() -> new ResourceGuard(probe, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResourceGuard(probe, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("JVM probe should report positive usage")
    void testJvmProbe() {
        assertThat(new JvmMemoryProbe().usedMb()).isPositive();
    }
}
