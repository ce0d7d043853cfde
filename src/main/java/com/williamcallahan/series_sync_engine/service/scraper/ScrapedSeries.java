package com.williamcallahan.series_sync_engine.service.scraper;

import java.util.List;

/**
 * Result of fetching a series' chapter list from a source.
 *
 * @param sourceId source-native id that was fetched
 * @param title title reported by the source, may be null
 * @param chapters chapters in source order
 */
public record ScrapedSeries(String sourceId, String title, List<ScrapedChapter> chapters) {

    public ScrapedSeries {
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }
}
