/**
 * Maps raw MangaDex catalog entries onto {@link SeriesCandidate} payloads
 *
 * @author William Callahan
 *
 * Features:
 * - Pools titles from the localized title map and every alternative title entry
 * - Picks English description first, then any language
 * - Resolves cover art file names, skipping avatar, logo and placeholder art
 * - Keeps only tags from the genre group
 */

package com.williamcallahan.series_sync_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.SeriesCandidate;
import com.williamcallahan.series_sync_engine.types.SourceName;
import com.williamcallahan.series_sync_engine.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
public class MangaDexCandidateMapper {

    static final String UNKNOWN_TITLE = "Unknown Title";
    static final String UNKNOWN_TYPE = "unknown";
    private static final List<String> REJECTED_COVER_MARKERS = List.of("avatar", "logo", "placeholder");

    private final PipelineProperties properties;

    public MangaDexCandidateMapper(PipelineProperties properties) {
        this.properties = properties;
    }

    /**
     * @param manga one entry of a catalog search response
     * @return candidate, empty when the entry carries no id
     */
    public Optional<SeriesCandidate> toCandidate(JsonNode manga) {
        String id = ValidationUtils.nullIfBlank(manga.path("id").asText(null));
        if (id == null) {
            return Optional.empty();
        }
        JsonNode attrs = manga.path("attributes");

        List<String> mainTitles = values(attrs.path("title"));
        List<String> altTitles = new ArrayList<>();
        for (JsonNode alt : attrs.path("altTitles")) {
            altTitles.addAll(values(alt));
        }
        String primary = !mainTitles.isEmpty() ? mainTitles.get(0)
            : !altTitles.isEmpty() ? altTitles.get(0)
            : UNKNOWN_TITLE;

        Set<String> pool = new LinkedHashSet<>(mainTitles);
        pool.addAll(altTitles);

        return Optional.of(SeriesCandidate.builder()
            .title(primary)
            .sourceName(SourceName.MANGADEX.getKey())
            .sourceId(id)
            .sourceUrl(properties.getCatalog().getTitleBaseUrl() + "/" + id)
            .externalId(id)
            .alternativeTitles(new ArrayList<>(pool))
            .description(description(attrs.path("description")))
            .coverUrl(coverUrl(id, manga.path("relationships")).orElse(null))
            .type(Optional.ofNullable(ValidationUtils.nullIfBlank(attrs.path("publicationDemographic").asText(null)))
                .orElse(UNKNOWN_TYPE))
            .status(ValidationUtils.nullIfBlank(attrs.path("status").asText(null)))
            .genres(genres(attrs.path("tags")))
            .contentRating(ValidationUtils.nullIfBlank(attrs.path("contentRating").asText(null)))
            .build());
    }

    Optional<String> coverUrl(String mangaId, JsonNode relationships) {
        for (JsonNode rel : relationships) {
            if (!"cover_art".equals(rel.path("type").asText())) {
                continue;
            }
            String fileName = ValidationUtils.nullIfBlank(rel.path("attributes").path("fileName").asText(null));
            if (fileName == null) {
                continue;
            }
            String lowered = fileName.toLowerCase(Locale.ROOT);
            if (REJECTED_COVER_MARKERS.stream().anyMatch(lowered::contains)) {
                return Optional.empty();
            }
            return Optional.of(properties.getCatalog().getCoverBaseUrl() + "/" + mangaId + "/" + fileName);
        }
        return Optional.empty();
    }

    private static String description(JsonNode descriptions) {
        String english = ValidationUtils.nullIfBlank(descriptions.path("en").asText(null));
        if (english != null) {
            return english;
        }
        List<String> any = values(descriptions);
        return any.isEmpty() ? null : any.get(0);
    }

    private static List<String> genres(JsonNode tags) {
        List<String> genres = new ArrayList<>();
        for (JsonNode tag : tags) {
            JsonNode tagAttrs = tag.path("attributes");
            if (!"genre".equals(tagAttrs.path("group").asText())) {
                continue;
            }
            String name = ValidationUtils.nullIfBlank(tagAttrs.path("name").path("en").asText(null));
            if (name != null) {
                genres.add(name);
            }
        }
        return genres;
    }

    private static List<String> values(JsonNode localized) {
        List<String> values = new ArrayList<>();
        Iterator<JsonNode> it = localized.elements();
        if (!localized.isObject()) {
            return values;
        }
        while (it.hasNext()) {
            String value = ValidationUtils.nullIfBlank(it.next().asText(null));
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
