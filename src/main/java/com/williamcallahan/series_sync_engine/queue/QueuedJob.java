package com.williamcallahan.series_sync_engine.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A job as stored by a {@link JobQueue}.
 *
 * @param id job id (dedup key)
 * @param queue owning queue
 * @param payload JSON payload
 * @param priority lower runs first
 * @param attemptsMade attempts that already finished with an error
 * @param retryPolicy attempt budget
 * @param enqueuedAt first enqueue time
 * @param lastError message of the most recent failure, null if none
 */
public record QueuedJob(
    String id,
    QueueName queue,
    JsonNode payload,
    int priority,
    int attemptsMade,
    RetryPolicy retryPolicy,
    Instant enqueuedAt,
    String lastError
) {

    static QueuedJob from(JobRequest request, Instant now) {
        return new QueuedJob(request.jobId(), request.queue(), request.payload(), request.priority(),
            0, request.retryPolicy(), now, null);
    }

    QueuedJob withFailure(int attempts, String error) {
        return new QueuedJob(id, queue, payload, priority, attempts, retryPolicy, enqueuedAt, error);
    }

    /**
     * @return the 1-based number of the attempt currently running
     */
    public int currentAttempt() {
        return attemptsMade + 1;
    }
}
