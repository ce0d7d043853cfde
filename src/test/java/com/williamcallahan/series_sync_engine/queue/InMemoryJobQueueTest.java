/**
 * Tests for the in-memory job queue
 * - Dedup by job id while unfinished
 * - Priority then FIFO ordering
 * - Retry with backoff, terminal failure and stalled lease recovery
 *
 * @author William Callahan
 */
package com.williamcallahan.series_sync_engine.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.testutil.MutableClock;
import com.williamcallahan.series_sync_engine.testutil.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobQueueTest {

    private static final Duration LEASE = Duration.ofMinutes(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(PipelineFixtures.NOW);
        queue = new InMemoryJobQueue(clock);
    }

    private JobRequest request(String id, int priority) {
        return JobRequest.of(QueueName.SYNC_SOURCE, id, objectMapper.createObjectNode().put("id", id), priority);
    }

    @Test
    void duplicateIdIsNoOpWhileUnfinished() {
        assertThat(queue.enqueue(request("a", 1))).isTrue();
        assertThat(queue.enqueue(request("a", 1))).isFalse();

        QueuedJob job = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();
        assertThat(queue.enqueue(request("a", 1))).isFalse();

        queue.complete(job);
        assertThat(queue.enqueue(request("a", 1))).isTrue();
    }

    @Test
    void pollsByPriorityThenInsertionOrder() {
        queue.enqueueBulk(List.of(request("cold", 3), request("hot-1", 1), request("warm", 2), request("hot-2", 1)));

        assertThat(queue.poll(QueueName.SYNC_SOURCE, LEASE)).map(QueuedJob::id).contains("hot-1");
        assertThat(queue.poll(QueueName.SYNC_SOURCE, LEASE)).map(QueuedJob::id).contains("hot-2");
        assertThat(queue.poll(QueueName.SYNC_SOURCE, LEASE)).map(QueuedJob::id).contains("warm");
        assertThat(queue.poll(QueueName.SYNC_SOURCE, LEASE)).map(QueuedJob::id).contains("cold");
        assertThat(queue.poll(QueueName.SYNC_SOURCE, LEASE)).isEmpty();
    }

    @Test
    void releasedJobReturnsToFrontOfItsBandWithoutAnAttempt() {
        queue.enqueueBulk(List.of(request("first", 1), request("second", 1)));
        QueuedJob claimed = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();

        queue.release(claimed);

        QueueCounts counts = queue.counts(QueueName.SYNC_SOURCE);
        assertThat(counts.active()).isZero();
        assertThat(counts.waiting()).isEqualTo(2);
        QueuedJob again = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();
        assertThat(again.id()).isEqualTo("first");
        assertThat(again.attemptsMade()).isZero();
    }

    @Test
    void enqueueBulkCountsOnlyAddedJobs() {
        queue.enqueue(request("a", 0));
        int added = queue.enqueueBulk(List.of(request("a", 0), request("b", 0), request("b", 0)));
        assertThat(added).isEqualTo(1);
    }

    @Test
    void retryableFailureIsDelayedWithBackoffThenPromoted() {
        queue.enqueue(request("a", 0));
        QueuedJob job = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();

        assertThat(queue.fail(job, new IllegalStateException("boom"))).isEqualTo(JobFailureOutcome.RETRY_SCHEDULED);
        assertThat(queue.counts(QueueName.SYNC_SOURCE).delayed()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(4));
        assertThat(queue.promoteDelayed(QueueName.SYNC_SOURCE, clock.instant())).isZero();

        clock.advance(Duration.ofSeconds(1));
        assertThat(queue.promoteDelayed(QueueName.SYNC_SOURCE, clock.instant())).isEqualTo(1);

        QueuedJob retried = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();
        assertThat(retried.attemptsMade()).isEqualTo(1);
        assertThat(retried.currentAttempt()).isEqualTo(2);
        assertThat(retried.lastError()).contains("boom");
    }

    @Test
    void exhaustedBudgetLandsInFailedHistory() {
        queue.enqueue(request("a", 0));
        for (int attempt = 1; attempt <= 3; attempt++) {
            clock.advance(Duration.ofMinutes(10));
            queue.promoteDelayed(QueueName.SYNC_SOURCE, clock.instant());
            QueuedJob job = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();
            JobFailureOutcome outcome = queue.fail(job, new IllegalStateException("attempt " + attempt));
            assertThat(outcome).isEqualTo(attempt < 3 ? JobFailureOutcome.RETRY_SCHEDULED : JobFailureOutcome.FAILED);
        }

        QueueCounts counts = queue.counts(QueueName.SYNC_SOURCE);
        assertThat(counts.failed()).isEqualTo(1);
        assertThat(counts.backlog()).isZero();
        assertThat(queue.recentFailures(QueueName.SYNC_SOURCE, 10))
            .singleElement()
            .satisfies(failed -> assertThat(failed.attemptsMade()).isEqualTo(3));
        assertThat(queue.enqueue(request("a", 0))).isTrue();
    }

    @Test
    void nonRetryableFailureIsTerminalOnFirstAttempt() {
        queue.enqueue(request("a", 0));
        QueuedJob job = queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();

        JobFailureOutcome outcome = queue.fail(job, new InvalidJobPayloadException("a", "bad payload"));

        assertThat(outcome).isEqualTo(JobFailureOutcome.FAILED);
        assertThat(queue.counts(QueueName.SYNC_SOURCE).delayed()).isZero();
    }

    @Test
    void expiredLeaseReturnsJobToWaiting() {
        queue.enqueue(request("a", 0));
        queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow();

        clock.advance(Duration.ofMinutes(4));
        assertThat(queue.requeueStalled(QueueName.SYNC_SOURCE, clock.instant())).isZero();

        clock.advance(Duration.ofMinutes(2));
        assertThat(queue.requeueStalled(QueueName.SYNC_SOURCE, clock.instant())).isEqualTo(1);

        Optional<QueuedJob> again = queue.poll(QueueName.SYNC_SOURCE, LEASE);
        assertThat(again).map(QueuedJob::id).contains("a");
    }

    @Test
    void completedHistoryIsTrimmedByAge() {
        queue.enqueue(request("a", 0));
        queue.complete(queue.poll(QueueName.SYNC_SOURCE, LEASE).orElseThrow());
        assertThat(queue.counts(QueueName.SYNC_SOURCE).completed()).isEqualTo(1);

        clock.advance(Duration.ofHours(2));
        assertThat(queue.counts(QueueName.SYNC_SOURCE).completed()).isZero();
    }

    @Test
    void queuesAreIndependent() {
        queue.enqueue(request("a", 0));
        assertThat(queue.poll(QueueName.NOTIFICATIONS, LEASE)).isEmpty();
        assertThat(queue.counts(QueueName.SYNC_SOURCE).waiting()).isEqualTo(1);
    }
}
