package com.fintech.gaps.resource;

import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.ResourceBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Keeps repairs under the process memory budget.
 *
 * <p>Headroom rules:
 * <ul>
 *   <li>Usage above {@code limitMb * headroomRatio} means insufficient headroom</li>
 *   <li>On insufficient headroom, one reclamation pass runs and usage is read again</li>
 *   <li>{@link #cleanup()} always reclaims, whatever the current usage</li>
 * </ul>
 *
 * <p>Single-threaded: batch processing is sequential, so there is one reader of
 * the process-wide budget at a time.
 */
public class ResourceGuard {

    private static final Logger log = LoggerFactory.getLogger(ResourceGuard.class);

    public static final double DEFAULT_HEADROOM_RATIO = 0.8;

    private final MemoryProbe probe;
    private final double headroomRatio;

    public ResourceGuard(MemoryProbe probe) {
        this(probe, DEFAULT_HEADROOM_RATIO);
    }

    public ResourceGuard(MemoryProbe probe, double headroomRatio) {
        if (headroomRatio <= 0 || headroomRatio > 1) {
            throw new IllegalArgumentException("Headroom ratio must be in (0, 1], got " + headroomRatio);
        }
        this.probe = probe;
        this.headroomRatio = headroomRatio;
    }

    public double currentUsageMb() {
        return probe.usedMb();
    }

    /** True if there is headroom under the budget, after at most one reclamation pass. */
    public boolean available(ResourceBudget budget) {
        return canAfford(budget, 0);
    }

    /**
     * True if an allocation of {@code additionalMb} fits under the headroom line,
     * after at most one reclamation pass.
     */
    public boolean canAfford(ResourceBudget budget, double additionalMb) {
        double line = budget.limitMb() * headroomRatio;
        if (probe.usedMb() + additionalMb <= line) {
            return true;
        }
        log.debug("Memory above headroom line, reclaiming: line={}MB, additional={}MB", line, additionalMb);
        probe.reclaim();
        double after = probe.usedMb();
        if (after + additionalMb <= line) {
            return true;
        }
        log.warn("Insufficient memory headroom: used={}MB, additional={}MB, limit={}MB",
                String.format(Locale.ROOT, "%.1f", after),
                String.format(Locale.ROOT, "%.1f", additionalMb),
                budget.limitMb());
        return false;
    }

    /**
     * @throws GapRepairException with {@link RepairErrorType#INSUFFICIENT_MEMORY} when headroom cannot be secured
     */
    public void ensureHeadroom(ResourceBudget budget) {
        ensureHeadroom(budget, 0);
    }

    /**
     * @throws GapRepairException with {@link RepairErrorType#INSUFFICIENT_MEMORY} when the allocation does not fit
     */
    public void ensureHeadroom(ResourceBudget budget, double additionalMb) {
        if (!canAfford(budget, additionalMb)) {
            throw new GapRepairException(RepairErrorType.INSUFFICIENT_MEMORY, String.format(Locale.ROOT,
                "Insufficient memory: %.1f MB in use, %.1f MB needed, limit %d MB",
                probe.usedMb(), additionalMb, budget.limitMb()));
        }
    }

    /** Unconditional reclamation, run after every file. */
    public void cleanup() {
        probe.reclaim();
        if (log.isTraceEnabled()) {
            log.trace("Post-file cleanup: used={}MB", probe.usedMb());
        }
    }
}
