package com.williamcallahan.series_sync_engine.queue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * The pipeline's named queues with their default retry, concurrency and rate settings.
 * Concurrency and rate limits can be overridden per queue through configuration.
 */
public enum QueueName {
    SYNC_SOURCE("sync-source", new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofMinutes(10)), 5, 10),
    CHECK_SOURCE("check-source", new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofMinutes(10)), 5, 5),
    CANONICALIZE("canonicalize", new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofMinutes(10)), 5, 0),
    NOTIFICATIONS("notifications", new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofMinutes(10)), 10, 0);

    private static final RetentionPolicy COMPLETED_RETENTION = new RetentionPolicy(100, Duration.ofHours(1));
    private static final RetentionPolicy FAILED_RETENTION = new RetentionPolicy(500, Duration.ofHours(24));

    private final String key;
    private final RetryPolicy retryPolicy;
    private final int defaultConcurrency;
    private final int defaultRatePerSecond;

    QueueName(String key, RetryPolicy retryPolicy, int defaultConcurrency, int defaultRatePerSecond) {
        this.key = key;
        this.retryPolicy = retryPolicy;
        this.defaultConcurrency = defaultConcurrency;
        this.defaultRatePerSecond = defaultRatePerSecond;
    }

    public String getKey() {
        return key;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    /**
     * @return jobs started per second, 0 for unlimited
     */
    public int getDefaultRatePerSecond() {
        return defaultRatePerSecond;
    }

    public RetentionPolicy getCompletedRetention() {
        return COMPLETED_RETENTION;
    }

    public RetentionPolicy getFailedRetention() {
        return FAILED_RETENTION;
    }

    public static Optional<QueueName> fromKey(String key) {
        return Arrays.stream(values()).filter(q -> q.key.equals(key)).findFirst();
    }
}
