package com.williamcallahan.series_sync_engine.types;

import java.time.Duration;
import java.util.Locale;

/**
 * Sync tier of a source link. The tier decides how often the master scheduler
 * re-checks the link and how urgently its sync job is picked up.
 */
public enum SyncPriority {
    HOT(Duration.ofMinutes(15), 1),
    WARM(Duration.ofHours(2), 2),
    COLD(Duration.ofHours(24), 3);

    private final Duration interval;
    private final int queueRank;

    SyncPriority(Duration interval, int queueRank) {
        this.interval = interval;
        this.queueRank = queueRank;
    }

    /**
     * @return time between two scheduled checks for this tier
     */
    public Duration getInterval() {
        return interval;
    }

    /**
     * @return queue priority for sync jobs of this tier, lower runs first
     */
    public int getQueueRank() {
        return queueRank;
    }

    /**
     * Parses a stored tier value. Unknown or missing values are treated as COLD,
     * the least aggressive schedule.
     *
     * @param raw stored value, case-insensitive
     * @return matching tier, or COLD
     */
    public static SyncPriority fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return COLD;
        }
        try {
            return SyncPriority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return COLD;
        }
    }
}
