/**
 * Request-path entry point deciding whether a user search should trigger discovery
 *
 * @author William Callahan
 *
 * Features:
 * - Rejects empty and oversized queries
 * - Ignores noise queries without touching the queue
 * - Per-client, per-query cooldown
 * - Consults the backpressure gate and never blocks or fails the caller
 */

package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.CheckSourceJobData;
import com.williamcallahan.series_sync_engine.dto.DiscoveryResponse;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.JobRequest;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.service.cache.CoordinationStore;
import com.williamcallahan.series_sync_engine.types.DiscoveryStatus;
import com.williamcallahan.series_sync_engine.types.DiscoveryTrigger;
import com.williamcallahan.series_sync_engine.types.SearchIntent;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import com.williamcallahan.series_sync_engine.util.RedisHelper;
import com.williamcallahan.series_sync_engine.util.SearchQueryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DiscoveryRequestService {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryRequestService.class);

    static final int KEYWORD_PRIORITY = 5;
    static final int TITLE_PRIORITY = 1;
    private static final String UNKNOWN_CLIENT = "anonymous";

    private final PipelineHealthGate healthGate;
    private final CoordinationStore coordinationStore;
    private final JobQueue jobQueue;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public DiscoveryRequestService(PipelineHealthGate healthGate,
                                   CoordinationStore coordinationStore,
                                   JobQueue jobQueue,
                                   PipelineProperties properties,
                                   ObjectMapper objectMapper) {
        this.healthGate = healthGate;
        this.coordinationStore = coordinationStore;
        this.jobQueue = jobQueue;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Decides what to do with a user search and enqueues discovery when warranted.
     *
     * @param query raw user query
     * @param clientKey caller identity used for the cooldown, may be null
     * @return coarse status for the caller
     */
    public DiscoveryResponse requestDiscovery(String query, String clientKey) {
        String canonical = query == null ? "" : SearchQueryUtils.canonicalize(query);
        if (canonical.length() < 2) {
            return new DiscoveryResponse(DiscoveryStatus.INVALID, null, null, null, "Query is too short");
        }
        if (canonical.length() > properties.getDiscovery().getMaxQueryLength()) {
            return new DiscoveryResponse(DiscoveryStatus.INVALID, null, null, null, "Query is too long");
        }

        SearchIntent intent = SearchIntent.detect(canonical);
        if (intent == SearchIntent.NOISE) {
            return new DiscoveryResponse(DiscoveryStatus.COMPLETE, canonical, intent, null, "Nothing to resolve");
        }

        String hash = SearchQueryUtils.keyHash(canonical);
        String cooldownKey = RedisHelper.searchCooldownKey(clientKey == null || clientKey.isBlank() ? UNKNOWN_CLIENT : clientKey, hash);
        if (coordinationStore.get(cooldownKey).isPresent()) {
            return new DiscoveryResponse(DiscoveryStatus.COMPLETE, canonical, intent, null, "Recently requested");
        }

        if (!healthGate.canEnqueueDiscovery()) {
            logger.info("Discovery for '{}' deferred: pipeline unavailable", canonical);
            return new DiscoveryResponse(DiscoveryStatus.RESOLVING_UNAVAILABLE, canonical, intent, null,
                "Discovery is temporarily unavailable");
        }

        String jobId = "search_" + hash;
        int priority = intent == SearchIntent.KEYWORD_EXPLORATION ? KEYWORD_PRIORITY : TITLE_PRIORITY;
        try {
            CheckSourceJobData payload = new CheckSourceJobData(canonical, null, intent, DiscoveryTrigger.USER_SEARCH);
            jobQueue.enqueue(JobRequest.of(QueueName.CHECK_SOURCE, jobId,
                JobPayloads.toJson(objectMapper, payload), priority));
            coordinationStore.set(cooldownKey, "1", properties.getDiscovery().getCooldown());
        } catch (RuntimeException e) {
            LoggingUtils.warn(logger, e, "Failed to enqueue discovery for '{}'", canonical);
            return new DiscoveryResponse(DiscoveryStatus.RESOLVING_UNAVAILABLE, canonical, intent, null,
                "Discovery is temporarily unavailable");
        }
        logger.debug("Enqueued discovery job {} for '{}' ({})", jobId, canonical, intent);
        return new DiscoveryResponse(DiscoveryStatus.RESOLVING, canonical, intent, jobId, "Searching external sources");
    }
}
