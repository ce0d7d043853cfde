package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a new-chapter notification job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationJobData(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("new_chapter_count") int newChapterCount
) {
}
