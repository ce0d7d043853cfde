/**
 * Canonical series record shared by every source that carries the same work
 *
 * @author William Callahan
 *
 * Features:
 * - One row per work regardless of how many sources list it
 * - External catalog id is unique when present
 * - Alternative titles accumulate across canonicalization runs
 * - Descriptive fields are filled once and then kept stable
 */

package com.williamcallahan.series_sync_engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Series {

    private String id;
    private String title;
    private String externalId;
    @Builder.Default
    private List<String> alternativeTitles = new ArrayList<>();
    private String description;
    private String coverUrl;
    private String type;
    private String status;
    @Builder.Default
    private List<String> genres = new ArrayList<>();
    private String contentRating;
    private Instant createdAt;
    private Instant updatedAt;
}
