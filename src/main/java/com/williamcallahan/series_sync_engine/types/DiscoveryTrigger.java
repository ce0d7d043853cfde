package com.williamcallahan.series_sync_engine.types;

/**
 * What caused a discovery job. User searches are served before background sweeps.
 */
public enum DiscoveryTrigger {
    USER_SEARCH(1),
    SYSTEM_SYNC(10);

    private final int canonicalizationPriority;

    DiscoveryTrigger(int canonicalizationPriority) {
        this.canonicalizationPriority = canonicalizationPriority;
    }

    public int getCanonicalizationPriority() {
        return canonicalizationPriority;
    }
}
