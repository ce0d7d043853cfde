/**
 * Process-local job queue used when no Redis server is configured
 *
 * @author William Callahan
 *
 * Features:
 * - Same dedup, priority, retry and retention semantics as the Redis queue
 * - Single lock per queue; all state lives on the heap and is lost on restart
 * - Used by tests and single-process deployments
 */

package com.williamcallahan.series_sync_engine.queue;

import com.williamcallahan.series_sync_engine.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

public class InMemoryJobQueue implements JobQueue {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private final Clock clock;
    private final Map<QueueName, QueueState> states = new EnumMap<>(QueueName.class);
    private long sequence;
    private long releasedSequence;

    public InMemoryJobQueue(Clock clock) {
        this.clock = clock;
        for (QueueName queue : QueueName.values()) {
            states.put(queue, new QueueState());
        }
    }

    @Override
    public synchronized boolean enqueue(JobRequest request) {
        QueueState state = states.get(request.queue());
        if (!state.liveIds.add(request.jobId())) {
            logger.debug("Skipping duplicate job {} on {}", request.jobId(), request.queue().getKey());
            return false;
        }
        state.waiting.add(new WaitingEntry(QueuedJob.from(request, clock.instant()), sequence++));
        return true;
    }

    @Override
    public synchronized Optional<QueuedJob> poll(QueueName queue, Duration lease) {
        QueueState state = states.get(queue);
        WaitingEntry next = state.waiting.poll();
        if (next == null) {
            return Optional.empty();
        }
        state.active.put(next.job().id(), new ActiveEntry(next.job(), clock.instant().plus(lease)));
        return Optional.of(next.job());
    }

    @Override
    public synchronized void complete(QueuedJob job) {
        QueueState state = states.get(job.queue());
        state.active.remove(job.id());
        state.liveIds.remove(job.id());
        record(state.completed, job, job.queue().getCompletedRetention());
    }

    @Override
    public synchronized JobFailureOutcome fail(QueuedJob job, Throwable error) {
        QueueState state = states.get(job.queue());
        int attempts = job.attemptsMade() + 1;
        QueuedJob failed = job.withFailure(attempts, describe(error));
        state.active.remove(job.id());

        if (PipelineException.isRetryable(error) && job.retryPolicy().allowsRetryAfter(attempts)) {
            Instant readyAt = clock.instant().plus(job.retryPolicy().backoffFor(attempts));
            state.delayed.add(new DelayedEntry(failed, readyAt));
            return JobFailureOutcome.RETRY_SCHEDULED;
        }

        state.liveIds.remove(job.id());
        record(state.failed, failed, job.queue().getFailedRetention());
        return JobFailureOutcome.FAILED;
    }

    @Override
    public synchronized void release(QueuedJob job) {
        QueueState state = states.get(job.queue());
        if (state.active.remove(job.id()) != null) {
            state.waiting.add(new WaitingEntry(job, --releasedSequence));
        }
    }

    @Override
    public synchronized int promoteDelayed(QueueName queue, Instant now) {
        QueueState state = states.get(queue);
        int moved = 0;
        while (!state.delayed.isEmpty() && !state.delayed.peek().readyAt().isAfter(now)) {
            DelayedEntry entry = state.delayed.poll();
            state.waiting.add(new WaitingEntry(entry.job(), sequence++));
            moved++;
        }
        return moved;
    }

    @Override
    public synchronized int requeueStalled(QueueName queue, Instant now) {
        QueueState state = states.get(queue);
        int moved = 0;
        Iterator<ActiveEntry> it = state.active.values().iterator();
        while (it.hasNext()) {
            ActiveEntry entry = it.next();
            if (entry.leaseUntil().isBefore(now)) {
                it.remove();
                state.waiting.add(new WaitingEntry(entry.job(), sequence++));
                moved++;
            }
        }
        if (moved > 0) {
            logger.warn("Requeued {} stalled job(s) on {}", moved, queue.getKey());
        }
        return moved;
    }

    @Override
    public synchronized QueueCounts counts(QueueName queue) {
        QueueState state = states.get(queue);
        prune(state.completed, queue.getCompletedRetention());
        prune(state.failed, queue.getFailedRetention());
        return new QueueCounts(state.waiting.size(), state.active.size(), state.delayed.size(),
            state.completed.size(), state.failed.size());
    }

    @Override
    public synchronized List<QueuedJob> recentFailures(QueueName queue, int limit) {
        QueueState state = states.get(queue);
        prune(state.failed, queue.getFailedRetention());
        List<QueuedJob> result = new ArrayList<>();
        for (FinishedEntry entry : state.failed) {
            if (result.size() >= limit) {
                break;
            }
            result.add(entry.job());
        }
        return result;
    }

    private void record(Deque<FinishedEntry> history, QueuedJob job, RetentionPolicy retention) {
        history.addFirst(new FinishedEntry(job, clock.instant()));
        prune(history, retention);
    }

    private void prune(Deque<FinishedEntry> history, RetentionPolicy retention) {
        Instant cutoff = clock.instant().minus(retention.maxAge());
        while (history.size() > retention.maxCount()
            || (!history.isEmpty() && history.peekLast().finishedAt().isBefore(cutoff))) {
            history.removeLast();
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private record WaitingEntry(QueuedJob job, long sequence) {
    }

    private record DelayedEntry(QueuedJob job, Instant readyAt) {
    }

    private record ActiveEntry(QueuedJob job, Instant leaseUntil) {
    }

    private record FinishedEntry(QueuedJob job, Instant finishedAt) {
    }

    private static final class QueueState {
        private final PriorityQueue<WaitingEntry> waiting = new PriorityQueue<>(
            Comparator.comparingInt((WaitingEntry e) -> e.job().priority()).thenComparingLong(WaitingEntry::sequence));
        private final PriorityQueue<DelayedEntry> delayed = new PriorityQueue<>(
            Comparator.comparing(DelayedEntry::readyAt));
        private final Map<String, ActiveEntry> active = new HashMap<>();
        private final Set<String> liveIds = new HashSet<>();
        private final Deque<FinishedEntry> completed = new ArrayDeque<>();
        private final Deque<FinishedEntry> failed = new ArrayDeque<>();
    }
}
