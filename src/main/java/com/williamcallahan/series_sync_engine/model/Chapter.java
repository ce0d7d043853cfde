package com.williamcallahan.series_sync_engine.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A chapter stored for one source link. Unique on (seriesSourceId, chapterNumber).
 *
 * @param seriesId series the owning link belongs to
 * @param seriesSourceId owning source link
 * @param chapterNumber decimal chapter number, e.g. 12.5
 * @param title chapter title, may be null
 * @param url chapter URL on the source
 * @param publishedAt source publication time, may be null
 */
public record Chapter(
    String seriesId,
    String seriesSourceId,
    BigDecimal chapterNumber,
    String title,
    String url,
    Instant publishedAt
) {
}
