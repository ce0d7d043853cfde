package com.williamcallahan.series_sync_engine.exception;

/**
 * Failure raised by a source scraper. Scrapers decide whether the failure is
 * worth another attempt (timeouts, 5xx, rate limits) or not (404, unparseable page).
 *
 * @author William Callahan
 */
public class ScraperException extends PipelineException {

    private final String sourceName;

    public ScraperException(String sourceName, String message, boolean retryable) {
        this(sourceName, message, retryable, null);
    }

    public ScraperException(String sourceName, String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
