package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.series_sync_engine.queue.QueueCounts;

import java.util.Map;

/**
 * Snapshot of worker liveness and queue depth.
 *
 * @param workersOnline a fresh worker heartbeat exists
 * @param acceptingDiscovery discovery requests would currently be enqueued
 * @param queues counts keyed by queue name
 */
public record PipelineStatusResponse(
    @JsonProperty("workers_online") boolean workersOnline,
    @JsonProperty("accepting_discovery") boolean acceptingDiscovery,
    Map<String, QueueCounts> queues
) {
}
