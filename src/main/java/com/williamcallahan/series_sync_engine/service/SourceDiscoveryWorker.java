/**
 * Queue handler searching the external catalog and fanning out canonicalization jobs
 *
 * @author William Callahan
 *
 * Features:
 * - Search term from the job query, or from the title of the referenced series
 * - Pages through the catalog until a short page, a rate limit or the page cap
 * - Deduplicates candidates by external id and keeps upstream relevance order
 * - One canonicalization job per candidate, prioritized by what triggered discovery
 */

package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.CheckSourceJobData;
import com.williamcallahan.series_sync_engine.dto.SeriesCandidate;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.mapper.MangaDexCandidateMapper;
import com.williamcallahan.series_sync_engine.model.Series;
import com.williamcallahan.series_sync_engine.queue.JobHandler;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.JobRequest;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.repository.SeriesRepository;
import com.williamcallahan.series_sync_engine.service.catalog.CatalogSearchPage;
import com.williamcallahan.series_sync_engine.service.catalog.ExternalCatalogClient;
import com.williamcallahan.series_sync_engine.types.DiscoveryTrigger;
import com.williamcallahan.series_sync_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class SourceDiscoveryWorker implements JobHandler {

    static final double CATALOG_CONFIDENCE = 100.0;

    private final ExternalCatalogClient catalogClient;
    private final MangaDexCandidateMapper candidateMapper;
    private final SeriesRepository seriesRepository;
    private final JobQueue jobQueue;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public SourceDiscoveryWorker(ExternalCatalogClient catalogClient,
                                 MangaDexCandidateMapper candidateMapper,
                                 SeriesRepository seriesRepository,
                                 JobQueue jobQueue,
                                 PipelineProperties properties,
                                 ObjectMapper objectMapper) {
        this.catalogClient = catalogClient;
        this.candidateMapper = candidateMapper;
        this.seriesRepository = seriesRepository;
        this.jobQueue = jobQueue;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public QueueName queue() {
        return QueueName.CHECK_SOURCE;
    }

    @Override
    public void handle(QueuedJob job) {
        CheckSourceJobData data = JobPayloads.read(objectMapper, job, CheckSourceJobData.class);
        String term = resolveSearchTerm(job.id(), data);
        DiscoveryTrigger trigger = data.trigger() != null ? data.trigger() : DiscoveryTrigger.SYSTEM_SYNC;

        List<SeriesCandidate> candidates = search(term);
        int enqueued = jobQueue.enqueueBulk(toJobs(candidates, trigger));
        log.info("Discovery for '{}' found {} candidate(s), enqueued {} canonicalization job(s) (trigger={})",
            term, candidates.size(), enqueued, trigger);
    }

    /**
     * Searches the catalog and returns deduplicated, ranked candidates.
     */
    List<SeriesCandidate> search(String term) {
        int pageLimit = properties.getDiscovery().getPageLimit();
        int maxPages = properties.getDiscovery().getMaxPages();
        Map<String, SeriesCandidate> byExternalId = new LinkedHashMap<>();

        for (int page = 0; page < maxPages; page++) {
            CatalogSearchPage result = catalogClient.search(term, page * pageLimit, pageLimit);
            if (result.isTerminal()) {
                log.debug("Stopping discovery paging for '{}' at page {} (rateLimited={}, failed={})",
                    term, page, result.rateLimited(), result.failed());
                break;
            }
            for (JsonNode entry : result.results()) {
                candidateMapper.toCandidate(entry)
                    .ifPresent(candidate -> byExternalId.putIfAbsent(candidate.externalId(), candidate));
            }
            if (result.results().size() < pageLimit) {
                break;
            }
        }

        List<SeriesCandidate> ranked = new ArrayList<>(byExternalId.size());
        int total = byExternalId.size();
        int index = 0;
        for (SeriesCandidate candidate : byExternalId.values()) {
            ranked.add(candidate.withConfidence(CATALOG_CONFIDENCE).withScore(total - index));
            index++;
        }
        return ranked;
    }

    private List<JobRequest> toJobs(List<SeriesCandidate> candidates, DiscoveryTrigger trigger) {
        List<JobRequest> jobs = new ArrayList<>(candidates.size());
        for (SeriesCandidate candidate : candidates) {
            jobs.add(JobRequest.of(QueueName.CANONICALIZE,
                "canon_" + candidate.sourceName() + "_" + candidate.externalId(),
                JobPayloads.toJson(objectMapper, candidate),
                trigger.getCanonicalizationPriority()));
        }
        return jobs;
    }

    private String resolveSearchTerm(String jobId, CheckSourceJobData data) {
        if (ValidationUtils.hasText(data.query())) {
            return data.query().trim();
        }
        if (ValidationUtils.hasText(data.seriesId())) {
            String title = seriesRepository.findById(data.seriesId())
                .map(Series::getTitle)
                .filter(ValidationUtils::hasText)
                .orElseThrow(() -> new InvalidJobPayloadException(jobId, "series " + data.seriesId() + " has no title"));
            return title;
        }
        throw new InvalidJobPayloadException(jobId, "either query or series_id is required");
    }
}
