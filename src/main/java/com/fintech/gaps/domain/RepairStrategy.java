package com.fintech.gaps.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of repair strategies. Dispatch on a strategy is an exhaustive
 * {@code switch}, so adding a constant fails compilation until every dispatcher
 * handles it.
 */
public enum RepairStrategy {

    /** Nothing to repair. */
    NONE("none", false),

    /** Complete grid, numeric fields linearly interpolated against time. */
    LINEAR("linear", true),

    /** Complete grid, natural cubic spline per numeric field. */
    CUBIC("cubic", true),

    /** Existing nulls take the previous known value; no rows added. */
    FORWARD_FILL("forward_fill", false),

    /** Existing nulls take the next known value; no rows added. */
    BACKWARD_FILL("backward_fill", false),

    /** Existing nulls linearly interpolated by row position; no rows added. */
    INTERPOLATE("interpolate", false),

    /** Complete grid, bounded forward fill then bounded backward fill. */
    SEASONAL("seasonal", true),

    /** Linear repair applied over overlapping row windows. */
    CHUNKED("chunked", true),

    /** Complete grid, centered rolling mean. A heuristic, not a trained model. */
    ML_FORECAST("ml_forecast", true),

    /** Complete grid, numeric fields filled with the column mean. */
    MEAN_FILL("mean_fill", true),

    /** Complete grid, numeric fields filled with the column median. */
    MEDIAN_FILL("median_fill", true);

    /** Strategy id asking for automatic selection from the gap report. */
    public static final String AUTO = "auto";

    private final String id;
    private final boolean buildsGrid;

    RepairStrategy(String id, boolean buildsGrid) {
        this.id = id;
        this.buildsGrid = buildsGrid;
    }

    /** Lower-case identifier used in configuration and results. */
    public String id() {
        return id;
    }

    /** True if the strategy inserts rows for missing time slots. */
    public boolean buildsGrid() {
        return buildsGrid;
    }

    /**
     * Resolves a strategy id, case-insensitively. Does not accept {@link #AUTO}.
     *
     * @throws IllegalArgumentException for unknown ids
     */
    public static RepairStrategy fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (RepairStrategy strategy : values()) {
                if (strategy.id.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown strategy '" + id + "'. Must be one of: auto, "
            + Arrays.stream(values()).map(RepairStrategy::id).collect(Collectors.joining(", ")));
    }

    public static boolean isAuto(String id) {
        return id == null || AUTO.equalsIgnoreCase(id.trim());
    }
}
