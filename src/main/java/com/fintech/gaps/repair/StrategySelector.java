package com.fintech.gaps.repair;

import com.fintech.gaps.domain.GapRepairException;
import com.fintech.gaps.domain.GapReport;
import com.fintech.gaps.domain.RepairErrorType;
import com.fintech.gaps.domain.RepairStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a gap profile to a repair strategy when the caller asks for {@code auto}.
 *
 * <p>Decision table, first match wins:
 * <ul>
 *   <li>no gaps: {@link RepairStrategy#NONE}</li>
 *   <li>average gap size up to 5: {@link RepairStrategy#FORWARD_FILL}</li>
 *   <li>up to 20: {@link RepairStrategy#LINEAR}</li>
 *   <li>up to 100: {@link RepairStrategy#CUBIC}</li>
 *   <li>otherwise: {@link RepairStrategy#CHUNKED}</li>
 * </ul>
 */
public class StrategySelector {

    private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

    static final double FORWARD_FILL_MAX_AVG = 5.0;
    static final double LINEAR_MAX_AVG = 20.0;
    static final double CUBIC_MAX_AVG = 100.0;

    public RepairStrategy select(GapReport report) {
        if (report.gapCount() == 0) {
            return RepairStrategy.NONE;
        }
        double average = report.averageGapSize();
        RepairStrategy strategy;
        if (average <= FORWARD_FILL_MAX_AVG) {
            strategy = RepairStrategy.FORWARD_FILL;
        } else if (average <= LINEAR_MAX_AVG) {
            strategy = RepairStrategy.LINEAR;
        } else if (average <= CUBIC_MAX_AVG) {
            strategy = RepairStrategy.CUBIC;
        } else {
            strategy = RepairStrategy.CHUNKED;
        }
        log.debug("Auto-selected strategy: avg_gap_size={}, strategy={}", average, strategy.id());
        return strategy;
    }

    /**
     * Resolves a requested strategy id. {@code auto} (or null) goes through
     * {@link #select(GapReport)}; anything else must be a known id.
     *
     * @throws GapRepairException with {@link RepairErrorType#UNKNOWN_STRATEGY} for unknown ids
     */
    public RepairStrategy resolve(String requested, GapReport report) {
        if (RepairStrategy.isAuto(requested)) {
            return select(report);
        }
        try {
            return RepairStrategy.fromId(requested);
        } catch (IllegalArgumentException e) {
            throw new GapRepairException(RepairErrorType.UNKNOWN_STRATEGY, e.getMessage(), e);
        }
    }
}
