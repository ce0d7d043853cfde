package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.dto.SeriesCandidate;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.service.CanonicalSeriesPersistenceService.CanonicalizationResult;
import com.williamcallahan.series_sync_engine.service.CanonicalSeriesPersistenceService.MatchRule;
import com.williamcallahan.series_sync_engine.service.event.SeriesAvailableEvent;
import com.williamcallahan.series_sync_engine.testutil.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CanonicalizationWorkerTest {

    private static final String SERIES_ID = "0190a0c8-0000-7000-8000-00000000000b";

    @Mock
    private CanonicalSeriesPersistenceService persistenceService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CanonicalizationWorker worker;

    @BeforeEach
    void setUp() {
        worker = new CanonicalizationWorker(persistenceService, eventPublisher, objectMapper);
    }

    private QueuedJob job(SeriesCandidate candidate) {
        return PipelineFixtures.job(objectMapper, QueueName.CANONICALIZE, "canon_mangadex_" + candidate.sourceId(), candidate);
    }

    @Test
    void canonicalizesAndAnnouncesSeries() {
        SeriesCandidate candidate = PipelineFixtures.candidate(PipelineFixtures.MANGADEX_ID, "Solo Leveling");
        when(persistenceService.canonicalize(any(SeriesCandidate.class))).thenReturn(
            new CanonicalizationResult(SERIES_ID, "Solo Leveling", PipelineFixtures.MANGADEX_ID, true, MatchRule.NONE));

        worker.handle(job(candidate));

        ArgumentCaptor<SeriesAvailableEvent> event = ArgumentCaptor.forClass(SeriesAvailableEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getSeriesId()).isEqualTo(SERIES_ID);
        assertThat(event.getValue().getExternalId()).isEqualTo(PipelineFixtures.MANGADEX_ID);
        assertThat(event.getValue().getTitle()).isEqualTo("Solo Leveling");
        assertThat(event.getValue().isCreated()).isTrue();
    }

    @Test
    void broadcastFailureDoesNotFailTheJob() {
        SeriesCandidate candidate = PipelineFixtures.candidate(PipelineFixtures.MANGADEX_ID, "Solo Leveling");
        when(persistenceService.canonicalize(any(SeriesCandidate.class))).thenReturn(
            new CanonicalizationResult(SERIES_ID, "Solo Leveling", PipelineFixtures.MANGADEX_ID, false, MatchRule.EXTERNAL_ID));
        doThrow(new IllegalStateException("broker down")).when(eventPublisher).publishEvent(any(Object.class));

        assertThatCode(() -> worker.handle(job(candidate))).doesNotThrowAnyException();
    }

    @Test
    void rejectsCandidateWithoutTitle() {
        SeriesCandidate candidate = PipelineFixtures.candidate("abc", " ");

        assertThatThrownBy(() -> worker.handle(job(candidate))).isInstanceOf(InvalidJobPayloadException.class);
        verifyNoInteractions(persistenceService, eventPublisher);
    }

    @Test
    void rejectsUnknownSource() {
        SeriesCandidate candidate = PipelineFixtures.candidate("abc", "Berserk").withSourceName("webtoons");

        assertThatThrownBy(() -> worker.handle(job(candidate)))
            .isInstanceOf(InvalidJobPayloadException.class)
            .hasMessageContaining("webtoons");
        verifyNoInteractions(persistenceService);
    }

    @Test
    void rejectsCandidateWithoutSourceUrl() {
        SeriesCandidate candidate = PipelineFixtures.candidate("abc", "Berserk").withSourceUrl(null);

        assertThatThrownBy(() -> worker.handle(job(candidate))).isInstanceOf(InvalidJobPayloadException.class);
    }
}
