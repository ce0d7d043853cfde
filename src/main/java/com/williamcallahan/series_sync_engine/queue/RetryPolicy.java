package com.williamcallahan.series_sync_engine.queue;

import java.time.Duration;

/**
 * Attempt budget and exponential backoff for one queue.
 *
 * @param maxAttempts total attempts including the first
 * @param baseDelay delay before the second attempt
 * @param maxDelay upper bound for any single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    private static final int MAX_SHIFT = 20;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    /**
     * @param attemptsMade attempts already finished, including the one that just failed
     * @return whether another attempt is allowed
     */
    public boolean allowsRetryAfter(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay before the next attempt: {@code baseDelay * 2^(attemptsMade - 1)}, capped at maxDelay.
     */
    public Duration backoffFor(int attemptsMade) {
        int shift = Math.min(Math.max(attemptsMade - 1, 0), MAX_SHIFT);
        long millis = baseDelay.toMillis() << shift;
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }
}
