package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;

import java.time.Instant;

/**
 * A terminally failed job as shown to operators.
 */
public record FailedJobResponse(
    String id,
    String queue,
    JsonNode payload,
    int attempts,
    @JsonProperty("enqueued_at") Instant enqueuedAt,
    @JsonProperty("last_error") String lastError
) {

    public static FailedJobResponse from(QueuedJob job) {
        return new FailedJobResponse(job.id(), job.queue().getKey(), job.payload(), job.attemptsMade(),
            job.enqueuedAt(), job.lastError());
    }
}
