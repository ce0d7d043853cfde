package com.williamcallahan.series_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Candidate series found by discovery, carried as the canonicalization job payload.
 *
 * @param title primary title
 * @param sourceName source the candidate came from
 * @param sourceId source-native id
 * @param sourceUrl public page of the candidate on its source
 * @param externalId external catalog id, null when the source is not the catalog
 * @param alternativeTitles every other known title
 * @param description description, may be null
 * @param coverUrl cover image URL, may be null
 * @param coverWidth cover width in pixels when the source reports it
 * @param coverHeight cover height in pixels when the source reports it
 * @param type publication type or demographic
 * @param status publication status
 * @param genres genre names
 * @param contentRating content rating
 * @param confidence match confidence, 0-100
 * @param score relevance rank within its discovery run, higher is better
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeriesCandidate(
    String title,
    @JsonProperty("source_name") String sourceName,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("external_id") String externalId,
    @JsonProperty("alternative_titles") List<String> alternativeTitles,
    String description,
    @JsonProperty("cover_url") String coverUrl,
    @JsonProperty("cover_width") Integer coverWidth,
    @JsonProperty("cover_height") Integer coverHeight,
    String type,
    String status,
    List<String> genres,
    @JsonProperty("content_rating") String contentRating,
    Double confidence,
    Integer score
) {

    public SeriesCandidate {
        alternativeTitles = alternativeTitles == null ? List.of() : List.copyOf(alternativeTitles);
        genres = genres == null ? List.of() : List.copyOf(genres);
    }
}
