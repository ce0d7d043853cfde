package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.series_sync_engine.types.DiscoveryStatus;
import com.williamcallahan.series_sync_engine.types.SearchIntent;

/**
 * Answer to a discovery request.
 *
 * @param status what happened to the request
 * @param query canonical query, null when rejected
 * @param intent detected intent, null when rejected
 * @param jobId discovery job id when one was enqueued
 * @param message human readable explanation
 */
public record DiscoveryResponse(
    DiscoveryStatus status,
    String query,
    SearchIntent intent,
    @JsonProperty("job_id") String jobId,
    String message
) {
}
