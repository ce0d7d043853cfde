/**
 * Consumer loop for a single queue
 *
 * @author William Callahan
 *
 * Features:
 * - Claims jobs only while below its concurrency limit
 * - Optional start-rate limit shared by every job of the queue
 * - Promotes due retries and reclaims stalled jobs before each claim round
 * - Reports outcomes back to the queue and to Micrometer
 */

package com.williamcallahan.series_sync_engine.queue;

import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class QueueWorker {

    private static final Logger logger = LoggerFactory.getLogger(QueueWorker.class);

    private final QueueName queue;
    private final JobQueue jobQueue;
    private final JobHandler handler;
    private final int concurrency;
    private final RateLimiter rateLimiter;
    private final Executor executor;
    private final Clock clock;
    private final Duration lease;
    private final Counter completedCounter;
    private final Counter retriedCounter;
    private final Counter failedCounter;

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public QueueWorker(JobQueue jobQueue,
                       JobHandler handler,
                       int concurrency,
                       @Nullable RateLimiter rateLimiter,
                       Executor executor,
                       Clock clock,
                       Duration lease,
                       @Nullable MeterRegistry meterRegistry) {
        this.queue = handler.queue();
        this.jobQueue = jobQueue;
        this.handler = handler;
        this.concurrency = concurrency;
        this.rateLimiter = rateLimiter;
        this.executor = executor;
        this.clock = clock;
        this.lease = lease;
        this.completedCounter = counter(meterRegistry, "completed");
        this.retriedCounter = counter(meterRegistry, "retried");
        this.failedCounter = counter(meterRegistry, "failed");
    }

    /**
     * Runs one claim round: moves due retries back to waiting, then dispatches
     * jobs until the queue is empty, the concurrency limit is reached or the
     * rate limiter refuses.
     *
     * @return number of jobs dispatched
     */
    public int pollOnce() {
        if (!accepting.get()) {
            return 0;
        }
        jobQueue.requeueStalled(queue, clock.instant());
        jobQueue.promoteDelayed(queue, clock.instant());

        int dispatched = 0;
        while (accepting.get() && inFlight.get() < concurrency) {
            Optional<QueuedJob> next = jobQueue.poll(queue, lease);
            if (next.isEmpty()) {
                break;
            }
            QueuedJob job = next.get();
            if (rateLimiter != null && !rateLimiter.acquirePermission()) {
                jobQueue.release(job);
                break;
            }
            inFlight.incrementAndGet();
            try {
                executor.execute(() -> process(job));
                dispatched++;
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                JobFailureOutcome outcome = jobQueue.fail(job, e);
                logger.warn("Executor for {} rejected job {}; recorded as failed attempt {} ({})",
                    queue.getKey(), job.id(), job.currentAttempt(), outcome);
                break;
            }
        }
        return dispatched;
    }

    void process(QueuedJob job) {
        try {
            handler.handle(job);
            jobQueue.complete(job);
            increment(completedCounter);
            logger.debug("Job {} on {} completed (attempt {})", job.id(), queue.getKey(), job.currentAttempt());
        } catch (Exception ex) {
            recordFailure(job, ex);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void recordFailure(QueuedJob job, Exception ex) {
        try {
            JobFailureOutcome outcome = jobQueue.fail(job, ex);
            if (outcome == JobFailureOutcome.RETRY_SCHEDULED) {
                increment(retriedCounter);
                logger.warn("Job {} on {} failed on attempt {}, retry scheduled: {}",
                    job.id(), queue.getKey(), job.currentAttempt(), ex.getMessage());
            } else {
                increment(failedCounter);
                LoggingUtils.error(logger, ex, "Job {} on {} failed permanently on attempt {}",
                    job.id(), queue.getKey(), job.currentAttempt());
            }
        } catch (RuntimeException queueError) {
            // The lease will expire and the job will be reclaimed
            LoggingUtils.error(logger, queueError, "Could not record failure of job {} on {}", job.id(), queue.getKey());
        }
    }

    public void stopAccepting() {
        accepting.set(false);
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public QueueName queue() {
        return queue;
    }

    public int concurrency() {
        return concurrency;
    }

    private Counter counter(MeterRegistry registry, String outcome) {
        if (registry == null) {
            return null;
        }
        return Counter.builder("pipeline.jobs")
            .description("Jobs finished by queue workers")
            .tag("queue", queue.getKey())
            .tag("outcome", outcome)
            .register(registry);
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
