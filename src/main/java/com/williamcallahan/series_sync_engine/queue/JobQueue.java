/**
 * Durable, prioritized job queue shared by the producers and workers of the pipeline
 *
 * @author William Callahan
 *
 * Features:
 * - Deduplicates on job id while a job is waiting, delayed or active
 * - Orders waiting jobs by priority, then by enqueue order
 * - Retries failed jobs with exponential backoff until the attempt budget runs out
 * - Keeps bounded history of completed and failed jobs
 * - Reports per-queue counts for backpressure decisions
 */

package com.williamcallahan.series_sync_engine.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobQueue {

    /**
     * Adds a job unless one with the same id is still unfinished.
     *
     * @return true when the job was added, false for a dedup no-op
     */
    boolean enqueue(JobRequest request);

    /**
     * Adds several jobs; duplicates are skipped individually.
     *
     * @return number of jobs actually added
     */
    default int enqueueBulk(List<JobRequest> requests) {
        int added = 0;
        for (JobRequest request : requests) {
            if (enqueue(request)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Claims the highest priority waiting job and marks it active.
     *
     * @param lease how long the claim holds before the job counts as stalled
     */
    Optional<QueuedJob> poll(QueueName queue, Duration lease);

    /**
     * Marks an active job finished successfully and releases its id.
     */
    void complete(QueuedJob job);

    /**
     * Records a failed attempt. Retryable errors within budget are rescheduled
     * with backoff; everything else lands in failed history and releases the id.
     */
    JobFailureOutcome fail(QueuedJob job, Throwable error);

    /**
     * Hands a claimed job back to the front of its priority band without
     * counting an attempt. Used when a job was claimed but could not be run.
     */
    void release(QueuedJob job);

    /**
     * Moves delayed jobs whose backoff has elapsed back to waiting.
     *
     * @return number of jobs moved
     */
    int promoteDelayed(QueueName queue, Instant now);

    /**
     * Returns active jobs whose lease expired (worker died mid-job) to waiting.
     *
     * @return number of jobs moved
     */
    int requeueStalled(QueueName queue, Instant now);

    QueueCounts counts(QueueName queue);

    /**
     * Most recent terminal failures, newest first.
     */
    List<QueuedJob> recentFailures(QueueName queue, int limit);
}
