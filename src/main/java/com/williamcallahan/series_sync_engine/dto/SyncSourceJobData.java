package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a chapter sync job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSourceJobData(@JsonProperty("series_source_id") String seriesSourceId) {
}
