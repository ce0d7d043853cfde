/**
 * Queue handler turning discovery candidates into canonical series
 *
 * @author William Callahan
 *
 * Features:
 * - Validates the candidate payload before touching the database
 * - Delegates matching and merging to CanonicalSeriesPersistenceService
 * - Announces the result; announcement failures never fail the job
 */

package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.dto.SeriesCandidate;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.queue.JobHandler;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.service.CanonicalSeriesPersistenceService.CanonicalizationResult;
import com.williamcallahan.series_sync_engine.service.event.SeriesAvailableEvent;
import com.williamcallahan.series_sync_engine.types.SourceName;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import com.williamcallahan.series_sync_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CanonicalizationWorker implements JobHandler {

    private final CanonicalSeriesPersistenceService persistenceService;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public CanonicalizationWorker(CanonicalSeriesPersistenceService persistenceService,
                                  ApplicationEventPublisher eventPublisher,
                                  ObjectMapper objectMapper) {
        this.persistenceService = persistenceService;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    @Override
    public QueueName queue() {
        return QueueName.CANONICALIZE;
    }

    @Override
    public void handle(QueuedJob job) {
        SeriesCandidate candidate = JobPayloads.read(objectMapper, job, SeriesCandidate.class);
        validate(job.id(), candidate);

        CanonicalizationResult result = persistenceService.canonicalize(candidate);
        log.info("Canonicalized {} {} into series {} (created={}, matchedBy={})",
            candidate.sourceName(), candidate.sourceId(), result.seriesId(), result.created(), result.matchedBy());

        try {
            eventPublisher.publishEvent(new SeriesAvailableEvent(
                result.seriesId(), result.externalId(), result.title(), result.created()));
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "series.available announcement failed for {}", result.seriesId());
        }
    }

    private static void validate(String jobId, SeriesCandidate candidate) {
        if (ValidationUtils.isNullOrBlank(candidate.title())) {
            throw new InvalidJobPayloadException(jobId, "title is required");
        }
        if (ValidationUtils.isNullOrBlank(candidate.sourceId())) {
            throw new InvalidJobPayloadException(jobId, "source_id is required");
        }
        if (SourceName.fromKey(candidate.sourceName()).isEmpty()) {
            throw new InvalidJobPayloadException(jobId, "unknown source_name " + candidate.sourceName());
        }
        if (ValidationUtils.isNullOrBlank(candidate.sourceUrl())) {
            throw new InvalidJobPayloadException(jobId, "source_url is required");
        }
    }
}
