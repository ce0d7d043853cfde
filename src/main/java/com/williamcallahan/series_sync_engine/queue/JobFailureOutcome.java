package com.williamcallahan.series_sync_engine.queue;

/**
 * What a queue did with a job whose handler threw.
 */
public enum JobFailureOutcome {
    RETRY_SCHEDULED,
    FAILED
}
