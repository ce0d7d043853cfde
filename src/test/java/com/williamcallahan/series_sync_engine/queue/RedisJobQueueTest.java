package com.williamcallahan.series_sync_engine.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.exception.ScraperException;
import com.williamcallahan.series_sync_engine.testutil.MutableClock;
import com.williamcallahan.series_sync_engine.testutil.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.JedisPooled;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisJobQueueTest {

    @Mock
    private JedisPooled jedis;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private RedisJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(PipelineFixtures.NOW);
        queue = new RedisJobQueue(jedis, objectMapper, clock, "kenmei:");
    }

    @SuppressWarnings("unchecked")
    private ArgumentCaptor<List<String>> listCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }

    private QueuedJob sampleJob(int attemptsMade) {
        return new QueuedJob("sync-1", QueueName.SYNC_SOURCE,
            objectMapper.createObjectNode().put("series_source_id", "abc"), 2, attemptsMade,
            QueueName.SYNC_SOURCE.getRetryPolicy(), PipelineFixtures.NOW, null);
    }

    @Test
    void enqueueUsesNamespacedKeysAndPriorityScore() {
        when(jedis.eval(eq(RedisJobQueue.ENQUEUE_SCRIPT), anyList(), anyList())).thenReturn(1L);
        ArgumentCaptor<List<String>> keys = listCaptor();
        ArgumentCaptor<List<String>> args = listCaptor();

        boolean added = queue.enqueue(JobRequest.of(QueueName.SYNC_SOURCE, "sync-1",
            objectMapper.createObjectNode(), 2));

        assertThat(added).isTrue();
        verify(jedis).eval(eq(RedisJobQueue.ENQUEUE_SCRIPT), keys.capture(), args.capture());
        assertThat(keys.getValue()).containsExactly(
            "kenmei:queue:sync-source:job:sync-1", "kenmei:queue:sync-source:wait");
        assertThat(Double.parseDouble(args.getValue().get(1)))
            .isEqualTo(RedisJobQueue.waitScore(2, PipelineFixtures.NOW.toEpochMilli()));
        assertThat(args.getValue().get(2)).isEqualTo("sync-1");
    }

    @Test
    void releaseMovesJobFromActiveBackToItsOriginalWaitScore() {
        ArgumentCaptor<List<String>> keys = listCaptor();
        ArgumentCaptor<List<String>> args = listCaptor();

        queue.release(sampleJob(0));

        verify(jedis).eval(eq(RedisJobQueue.RELEASE_SCRIPT), keys.capture(), args.capture());
        assertThat(keys.getValue()).containsExactly(
            "kenmei:queue:sync-source:active", "kenmei:queue:sync-source:wait");
        assertThat(args.getValue().get(0)).isEqualTo("sync-1");
        assertThat(Double.parseDouble(args.getValue().get(1)))
            .isEqualTo(RedisJobQueue.waitScore(2, PipelineFixtures.NOW.toEpochMilli()));
    }

    @Test
    void enqueueReportsDuplicate() {
        when(jedis.eval(eq(RedisJobQueue.ENQUEUE_SCRIPT), anyList(), anyList())).thenReturn(0L);

        assertThat(queue.enqueue(JobRequest.of(QueueName.SYNC_SOURCE, "sync-1", objectMapper.createObjectNode())))
            .isFalse();
    }

    @Test
    void lowerPriorityAlwaysScoresAheadOfLaterBands() {
        long later = PipelineFixtures.NOW.plus(Duration.ofDays(365)).toEpochMilli();
        assertThat(RedisJobQueue.waitScore(1, later))
            .isLessThan(RedisJobQueue.waitScore(2, PipelineFixtures.NOW.toEpochMilli()));
    }

    @Test
    void pollDeserializesStoredJob() {
        QueuedJob stored = sampleJob(1);
        when(jedis.eval(eq(RedisJobQueue.POLL_SCRIPT), anyList(), anyList()))
            .thenReturn(List.of("sync-1", queue.serialize(stored, null)));

        Optional<QueuedJob> polled = queue.poll(QueueName.SYNC_SOURCE, Duration.ofMinutes(5));

        assertThat(polled).isPresent();
        assertThat(polled.get().id()).isEqualTo("sync-1");
        assertThat(polled.get().priority()).isEqualTo(2);
        assertThat(polled.get().attemptsMade()).isEqualTo(1);
        assertThat(polled.get().payload().path("series_source_id").asText()).isEqualTo("abc");
        assertThat(polled.get().retryPolicy()).isEqualTo(QueueName.SYNC_SOURCE.getRetryPolicy());
    }

    @Test
    void pollSkipsOrphanedIds() {
        when(jedis.eval(eq(RedisJobQueue.POLL_SCRIPT), anyList(), anyList())).thenReturn(List.of("ghost"));

        assertThat(queue.poll(QueueName.SYNC_SOURCE, Duration.ofMinutes(5))).isEmpty();
    }

    @Test
    void pollOnEmptyQueue() {
        when(jedis.eval(eq(RedisJobQueue.POLL_SCRIPT), anyList(), anyList())).thenReturn(null);

        assertThat(queue.poll(QueueName.SYNC_SOURCE, Duration.ofMinutes(5))).isEmpty();
    }

    @Test
    void retryableFailureMovesJobToDelayedSet() {
        ArgumentCaptor<List<String>> keys = listCaptor();
        ArgumentCaptor<List<String>> args = listCaptor();

        JobFailureOutcome outcome = queue.fail(sampleJob(0), new ScraperException("mangadex", "timeout", true));

        assertThat(outcome).isEqualTo(JobFailureOutcome.RETRY_SCHEDULED);
        verify(jedis).eval(eq(RedisJobQueue.RETRY_SCRIPT), keys.capture(), args.capture());
        assertThat(keys.getValue()).containsExactly("kenmei:queue:sync-source:active",
            "kenmei:queue:sync-source:job:sync-1", "kenmei:queue:sync-source:delayed");
        assertThat(args.getValue().get(2))
            .isEqualTo(String.valueOf(PipelineFixtures.NOW.toEpochMilli() + 5_000));
    }

    @Test
    void nonRetryableFailureFinishesIntoFailedHistory() {
        ArgumentCaptor<List<String>> keys = listCaptor();

        JobFailureOutcome outcome = queue.fail(sampleJob(0), new ScraperException("mangadex", "404", false));

        assertThat(outcome).isEqualTo(JobFailureOutcome.FAILED);
        verify(jedis).eval(eq(RedisJobQueue.FINISH_SCRIPT), keys.capture(), anyList());
        assertThat(keys.getValue()).containsExactly("kenmei:queue:sync-source:active",
            "kenmei:queue:sync-source:job:sync-1", "kenmei:queue:sync-source:failed");
    }

    @Test
    void countsReadEachStructure() {
        when(jedis.zcard("kenmei:queue:check-source:wait")).thenReturn(4L);
        when(jedis.zcard("kenmei:queue:check-source:active")).thenReturn(2L);
        when(jedis.zcard("kenmei:queue:check-source:delayed")).thenReturn(1L);

        QueueCounts counts = queue.counts(QueueName.CHECK_SOURCE);

        assertThat(counts.backlog()).isEqualTo(7);
    }

    @Test
    void unknownQueueInStoredRecordIsDiscarded() {
        assertThat(queue.deserialize("{\"id\":\"x\",\"queue\":\"nope\"}")).isEmpty();
        assertThat(queue.deserialize("not json")).isEmpty();
    }
}
