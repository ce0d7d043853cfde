package com.williamcallahan.series_sync_engine.types;

/**
 * Outcome of a discovery request as reported to the caller.
 */
public enum DiscoveryStatus {
    /** Query rejected before any work was considered. */
    INVALID,
    /** Nothing to resolve (noise query or cooldown hit). */
    COMPLETE,
    /** A discovery job was accepted. */
    RESOLVING,
    /** Workers offline or backlog too deep; nothing enqueued. */
    RESOLVING_UNAVAILABLE
}
