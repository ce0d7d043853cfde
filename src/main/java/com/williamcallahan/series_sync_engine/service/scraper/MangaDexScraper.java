/**
 * Chapter list scraper backed by the MangaDex feed API
 *
 * @author William Callahan
 *
 * Features:
 * - Pages through the English chapter feed of a title
 * - Maps HTTP failures onto retryable and non-retryable scraper errors
 * - Skips chapters without a numeric chapter number
 */

package com.williamcallahan.series_sync_engine.service.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.exception.ScraperException;
import com.williamcallahan.series_sync_engine.types.SourceName;
import com.williamcallahan.series_sync_engine.util.UuidUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class MangaDexScraper implements Scraper {

    static final int FEED_PAGE_SIZE = 500;
    static final int MAX_FEED_PAGES = 20;
    private static final String CHAPTER_BASE_URL = "https://mangadex.org/chapter/";

    private final WebClient webClient;
    private final PipelineProperties properties;

    public MangaDexScraper(WebClient.Builder webClientBuilder, PipelineProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public SourceName source() {
        return SourceName.MANGADEX;
    }

    @Override
    public ScrapedSeries fetchChapters(String sourceId) {
        if (!UuidUtil.isUuid(sourceId)) {
            throw new ScraperException(source().getKey(), "Not a MangaDex id: " + sourceId, false);
        }
        List<ScrapedChapter> chapters = new ArrayList<>();
        String title = null;
        int offset = 0;
        int total;
        int pages = 0;
        do {
            JsonNode body = fetchFeedPage(sourceId, offset);
            for (JsonNode item : body.path("data")) {
                parseChapter(item).ifPresent(chapters::add);
                if (title == null) {
                    title = mangaTitle(item);
                }
            }
            total = body.path("total").asInt(0);
            offset += FEED_PAGE_SIZE;
            pages++;
        } while (offset < total && pages < MAX_FEED_PAGES);

        log.debug("Fetched {} chapter(s) for MangaDex title {} in {} page(s)", chapters.size(), sourceId, pages);
        return new ScrapedSeries(sourceId, title, chapters);
    }

    JsonNode fetchFeedPage(String mangaId, int offset) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getCatalog().getBaseUrl())
            .pathSegment("manga", mangaId, "feed")
            .queryParam("translatedLanguage[]", "en")
            .queryParam("limit", FEED_PAGE_SIZE)
            .queryParam("offset", offset)
            .queryParam("order[chapter]", "asc")
            .queryParam("includes[]", "manga")
            .encode()
            .build()
            .toUri();
        try {
            JsonNode body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getSync().getScrapeTimeout())
                .block();
            if (body == null) {
                throw new ScraperException(source().getKey(), "Empty feed response for " + mangaId, false);
            }
            return body;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || e.getStatusCode().is5xxServerError();
            throw new ScraperException(source().getKey(),
                "MangaDex feed returned " + status + " for " + mangaId, retryable, e);
        } catch (WebClientRequestException e) {
            throw new ScraperException(source().getKey(), "MangaDex unreachable: " + e.getMessage(), true, e);
        } catch (ScraperException e) {
            throw e;
        } catch (RuntimeException e) {
            // Reactor timeouts surface here wrapped in a RuntimeException
            throw new ScraperException(source().getKey(), "MangaDex feed failed for " + mangaId + ": " + e.getMessage(), true, e);
        }
    }

    static Optional<ScrapedChapter> parseChapter(JsonNode item) {
        JsonNode attrs = item.path("attributes");
        String rawNumber = attrs.path("chapter").asText(null);
        if (rawNumber == null || rawNumber.isBlank()) {
            return Optional.empty();
        }
        BigDecimal number;
        try {
            number = new BigDecimal(rawNumber.trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String chapterTitle = attrs.hasNonNull("title") ? attrs.get("title").asText() : null;
        String url = CHAPTER_BASE_URL + item.path("id").asText();
        return Optional.of(new ScrapedChapter(number, chapterTitle, url, parseInstant(attrs.path("publishAt").asText(null))));
    }

    private static String mangaTitle(JsonNode item) {
        for (JsonNode rel : item.path("relationships")) {
            if ("manga".equals(rel.path("type").asText())) {
                Iterator<Map.Entry<String, JsonNode>> fields = rel.path("attributes").path("title").fields();
                if (fields.hasNext()) {
                    return fields.next().getValue().asText();
                }
            }
        }
        return null;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
