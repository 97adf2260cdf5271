package com.fintech.gaps.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-file lifecycle of {@link GapFixerOrchestrator}.
 *
 * <pre>
 * IDLE -&gt; LOADED -&gt; DETECTED -&gt; NO_GAPS_FOUND -&gt; IDLE
 *                             -&gt; REPAIRING -&gt; SAVED -&gt; IDLE
 * any  -&gt; ERROR -&gt; IDLE
 * </pre>
 * In-memory repairs leave {@code REPAIRING} straight for {@code IDLE}, since there
 * is nothing to save.
 */
public enum OrchestratorState {

    IDLE,
    LOADED,
    DETECTED,
    NO_GAPS_FOUND,
    REPAIRING,
    SAVED,
    ERROR;

    /** True if the lifecycle allows moving from this state to {@code next}. */
    public boolean canTransitionTo(OrchestratorState next) {
        return next == ERROR || successors().contains(next);
    }

    private Set<OrchestratorState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(LOADED);
            case LOADED -> EnumSet.of(DETECTED);
            case DETECTED -> EnumSet.of(NO_GAPS_FOUND, REPAIRING);
            case NO_GAPS_FOUND, SAVED, ERROR -> EnumSet.of(IDLE);
            case REPAIRING -> EnumSet.of(SAVED, IDLE);
        };
    }
}
