package com.fintech.gaps.resource;

/**
 * Reads and reclaims process memory. Injected into {@link ResourceGuard} so the
 * guard can be driven by a fake reader in tests.
 */
public interface MemoryProbe {

    /** Current process memory usage in megabytes. */
    double usedMb();

    /** Requests a garbage-collection pass. Returns once the request has been made. */
    void reclaim();
}
