package com.williamcallahan.series_sync_engine.service.scraper;

import com.williamcallahan.series_sync_engine.exception.ScraperException;
import com.williamcallahan.series_sync_engine.types.SourceName;

/**
 * Fetches the chapter list of one series from one source.
 * Implementations report failures as {@link ScraperException} and decide retryability.
 */
public interface Scraper {

    SourceName source();

    ScrapedSeries fetchChapters(String sourceId) throws ScraperException;
}
