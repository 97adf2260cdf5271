package com.fintech.gaps.domain;

/**
 * Process-wide memory ceiling a repair must stay under.
 *
 * @param limitMb ceiling in megabytes, at least 1
 */
public record ResourceBudget(long limitMb) {

    public ResourceBudget {
        if (limitMb < 1) {
            throw new IllegalArgumentException("Memory limit must be at least 1 MB, got " + limitMb);
        }
    }
}
