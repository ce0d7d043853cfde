package com.williamcallahan.series_sync_engine.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A job to be enqueued. The job id doubles as the dedup key: enqueueing an id
 * that is still waiting, delayed or active is a no-op.
 *
 * @param queue target queue
 * @param jobId caller-chosen id
 * @param payload JSON payload handed to the handler
 * @param priority lower runs first
 * @param retryPolicy attempt budget, defaults to the queue's policy
 */
public record JobRequest(QueueName queue, String jobId, JsonNode payload, int priority, RetryPolicy retryPolicy) {

    public static final int DEFAULT_PRIORITY = 0;

    public JobRequest {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(payload, "payload");
        if (retryPolicy == null) {
            retryPolicy = queue.getRetryPolicy();
        }
    }

    public static JobRequest of(QueueName queue, String jobId, JsonNode payload, int priority) {
        return new JobRequest(queue, jobId, payload, priority, null);
    }

    public static JobRequest of(QueueName queue, String jobId, JsonNode payload) {
        return of(queue, jobId, payload, DEFAULT_PRIORITY);
    }
}
