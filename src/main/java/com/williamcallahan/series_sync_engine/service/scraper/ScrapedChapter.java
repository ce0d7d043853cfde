package com.williamcallahan.series_sync_engine.service.scraper;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One chapter as listed by a source.
 */
public record ScrapedChapter(BigDecimal number, String title, String url, Instant publishedAt) {
}
