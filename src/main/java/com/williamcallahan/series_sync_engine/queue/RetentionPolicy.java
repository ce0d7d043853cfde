package com.williamcallahan.series_sync_engine.queue;

import java.time.Duration;

/**
 * Bound on how many finished jobs a queue keeps, and for how long.
 */
public record RetentionPolicy(int maxCount, Duration maxAge) {
}
