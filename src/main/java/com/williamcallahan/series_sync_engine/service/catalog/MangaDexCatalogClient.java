/**
 * MangaDex title search client
 *
 * @author William Callahan
 *
 * Features:
 * - Title search across every content rating, with cover art relationships included
 * - 429 reported as a rate-limited page so callers stop paging
 * - Other failures logged and reported as a failed page
 */

package com.williamcallahan.series_sync_engine.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.types.SourceName;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class MangaDexCatalogClient implements ExternalCatalogClient {

    static final List<String> CONTENT_RATINGS = List.of("safe", "suggestive", "erotica", "pornographic");

    private final WebClient webClient;
    private final PipelineProperties properties;

    public MangaDexCatalogClient(WebClient.Builder webClientBuilder, PipelineProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public SourceName source() {
        return SourceName.MANGADEX;
    }

    @Override
    public CatalogSearchPage search(String title, int offset, int limit) {
        URI uri = buildSearchUri(title, offset, limit);
        log.debug("Searching MangaDex: title='{}', offset={}, limit={}", title, offset, limit);
        try {
            JsonNode body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getCatalog().getTimeout())
                .block();
            List<JsonNode> results = new ArrayList<>();
            if (body != null) {
                body.path("data").forEach(results::add);
            }
            return CatalogSearchPage.of(results);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 429) {
                log.warn("MangaDex rate limit hit while searching '{}' at offset {}", title, offset);
                return CatalogSearchPage.rateLimitedPage();
            }
            log.warn("MangaDex search for '{}' returned {}", title, e.getStatusCode().value());
            return CatalogSearchPage.failedPage();
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "MangaDex search for '{}' failed", title);
            return CatalogSearchPage.failedPage();
        }
    }

    URI buildSearchUri(String title, int offset, int limit) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getCatalog().getBaseUrl())
            .pathSegment("manga")
            .queryParam("title", title)
            .queryParam("limit", limit)
            .queryParam("offset", offset)
            .queryParam("includes[]", "cover_art");
        CONTENT_RATINGS.forEach(rating -> builder.queryParam("contentRating[]", rating));
        return builder.queryParam("order[relevance]", "desc")
            .encode()
            .build()
            .toUri();
    }
}
