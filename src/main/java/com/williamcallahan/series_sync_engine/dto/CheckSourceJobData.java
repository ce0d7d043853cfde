package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.series_sync_engine.types.DiscoveryTrigger;
import com.williamcallahan.series_sync_engine.types.SearchIntent;

/**
 * Payload of a discovery job. Either the query or the series id must be present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckSourceJobData(
    String query,
    @JsonProperty("series_id") String seriesId,
    SearchIntent intent,
    DiscoveryTrigger trigger
) {
}
