package com.williamcallahan.series_sync_engine.queue;

/**
 * Processes jobs of one queue. Returning normally completes the job; throwing
 * hands the error to the queue's retry policy.
 */
public interface JobHandler {

    QueueName queue();

    void handle(QueuedJob job) throws Exception;
}
