package com.williamcallahan.series_sync_engine.types;

/**
 * Health of a source link derived from its consecutive failure count.
 */
public enum SourceHealth {
    HEALTHY,
    DEGRADED,
    CIRCUIT_OPEN;

    /** Consecutive failures after which a link stops being fetched. */
    public static final int MAX_CONSECUTIVE_FAILURES = 5;

    public static SourceHealth of(int failureCount) {
        if (failureCount >= MAX_CONSECUTIVE_FAILURES) {
            return CIRCUIT_OPEN;
        }
        return failureCount > 0 ? DEGRADED : HEALTHY;
    }
}
