/**
 * Tests for DiscoveryRequestService
 *
 * @author William Callahan
 *
 * Covers query validation, intent routing, the per-client cooldown and
 * the health gate that keeps discovery from piling up when workers are down
 */

package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.DiscoveryResponse;
import com.williamcallahan.series_sync_engine.queue.InMemoryJobQueue;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.service.cache.InMemoryCoordinationStore;
import com.williamcallahan.series_sync_engine.testutil.MutableClock;
import com.williamcallahan.series_sync_engine.testutil.PipelineFixtures;
import com.williamcallahan.series_sync_engine.types.DiscoveryStatus;
import com.williamcallahan.series_sync_engine.types.SearchIntent;
import com.williamcallahan.series_sync_engine.util.SearchQueryUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryRequestServiceTest {

    @Mock
    private PipelineHealthGate healthGate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PipelineProperties properties = new PipelineProperties();
    private InMemoryCoordinationStore coordinationStore;
    private InMemoryJobQueue jobQueue;
    private DiscoveryRequestService service;

    @BeforeEach
    void setUp() {
        coordinationStore = new InMemoryCoordinationStore();
        jobQueue = new InMemoryJobQueue(new MutableClock(PipelineFixtures.NOW));
        service = new DiscoveryRequestService(healthGate, coordinationStore, jobQueue, properties, objectMapper);
    }

    @Test
    void titleSearchEnqueuesHighPriorityDiscovery() {
        when(healthGate.canEnqueueDiscovery()).thenReturn(true);

        DiscoveryResponse response = service.requestDiscovery("  Solo   Leveling ", "10.0.0.1");

        assertThat(response.status()).isEqualTo(DiscoveryStatus.RESOLVING);
        assertThat(response.query()).isEqualTo("solo leveling");
        assertThat(response.intent()).isEqualTo(SearchIntent.PARTIAL_TITLE);
        assertThat(response.jobId()).isEqualTo("search_" + SearchQueryUtils.keyHash("solo leveling"));

        QueuedJob job = jobQueue.poll(QueueName.CHECK_SOURCE, Duration.ofMinutes(1)).orElseThrow();
        assertThat(job.id()).isEqualTo(response.jobId());
        assertThat(job.priority()).isEqualTo(DiscoveryRequestService.TITLE_PRIORITY);
        assertThat(job.payload().path("query").asText()).isEqualTo("solo leveling");
        assertThat(job.payload().path("trigger").asText()).isEqualTo("USER_SEARCH");
    }

    @Test
    void shortKeywordGetsLowerPriority() {
        when(healthGate.canEnqueueDiscovery()).thenReturn(true);

        DiscoveryResponse response = service.requestDiscovery("bl", "10.0.0.1");

        assertThat(response.intent()).isEqualTo(SearchIntent.KEYWORD_EXPLORATION);
        assertThat(jobQueue.poll(QueueName.CHECK_SOURCE, Duration.ofMinutes(1)).orElseThrow().priority())
            .isEqualTo(DiscoveryRequestService.KEYWORD_PRIORITY);
    }

    @Test
    void repeatWithinCooldownIsAnsweredWithoutEnqueue() {
        when(healthGate.canEnqueueDiscovery()).thenReturn(true);
        service.requestDiscovery("solo leveling", "10.0.0.1");
        jobQueue.poll(QueueName.CHECK_SOURCE, Duration.ofMinutes(1));

        DiscoveryResponse repeat = service.requestDiscovery("Solo Leveling", "10.0.0.1");

        assertThat(repeat.status()).isEqualTo(DiscoveryStatus.COMPLETE);
        assertThat(repeat.jobId()).isNull();
        assertThat(jobQueue.counts(QueueName.CHECK_SOURCE).waiting()).isZero();
    }

    @Test
    void cooldownIsPerClient() {
        when(healthGate.canEnqueueDiscovery()).thenReturn(true);
        service.requestDiscovery("solo leveling", "10.0.0.1");

        assertThat(service.requestDiscovery("solo leveling", "10.0.0.2").status()).isEqualTo(DiscoveryStatus.RESOLVING);
    }

    @Test
    void unavailablePipelineDefersWithoutCooldown() {
        when(healthGate.canEnqueueDiscovery()).thenReturn(false, true);

        DiscoveryResponse deferred = service.requestDiscovery("solo leveling", null);
        DiscoveryResponse retried = service.requestDiscovery("solo leveling", null);

        assertThat(deferred.status()).isEqualTo(DiscoveryStatus.RESOLVING_UNAVAILABLE);
        assertThat(retried.status()).isEqualTo(DiscoveryStatus.RESOLVING);
    }

    @Test
    void enqueueFailureReportsUnavailable() {
        JobQueue brokenQueue = mock(JobQueue.class);
        when(brokenQueue.enqueue(any())).thenThrow(new IllegalStateException("connection refused"));
        when(healthGate.canEnqueueDiscovery()).thenReturn(true);
        DiscoveryRequestService isolated = new DiscoveryRequestService(healthGate, coordinationStore, brokenQueue,
            properties, objectMapper);

        DiscoveryResponse response = isolated.requestDiscovery("solo leveling", "10.0.0.1");

        assertThat(response.status()).isEqualTo(DiscoveryStatus.RESOLVING_UNAVAILABLE);
        assertThat(coordinationStore.get(
            "cooldown:search:10.0.0.1:" + SearchQueryUtils.keyHash("solo leveling"))).isEmpty();
    }

    @Test
    void tooShortAndTooLongQueriesAreInvalid() {
        assertThat(service.requestDiscovery(null, "c").status()).isEqualTo(DiscoveryStatus.INVALID);
        assertThat(service.requestDiscovery(" a ", "c").status()).isEqualTo(DiscoveryStatus.INVALID);
        assertThat(service.requestDiscovery("x".repeat(201), "c").status()).isEqualTo(DiscoveryStatus.INVALID);
    }

    @Test
    void punctuationOnlyQueryIsNoise() {
        DiscoveryResponse response = service.requestDiscovery("?!?", "c");

        assertThat(response.status()).isEqualTo(DiscoveryStatus.COMPLETE);
        assertThat(response.intent()).isEqualTo(SearchIntent.NOISE);
        assertThat(jobQueue.counts(QueueName.CHECK_SOURCE).waiting()).isZero();
    }
}
