package com.williamcallahan.series_sync_engine.queue;

/**
 * Point-in-time job counts for one queue.
 */
public record QueueCounts(long waiting, long active, long delayed, long completed, long failed) {

    public static final QueueCounts EMPTY = new QueueCounts(0, 0, 0, 0, 0);

    /**
     * @return jobs not yet finished
     */
    public long backlog() {
        return waiting + active + delayed;
    }
}
