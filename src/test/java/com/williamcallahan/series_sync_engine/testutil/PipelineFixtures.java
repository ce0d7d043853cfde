package com.williamcallahan.series_sync_engine.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.series_sync_engine.dto.SeriesCandidate;
import com.williamcallahan.series_sync_engine.model.SeriesSource;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.types.SyncPriority;

import java.time.Instant;
import java.util.List;

/** Shared builders for pipeline tests. */
public final class PipelineFixtures {

    public static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    public static final String MANGADEX_ID = "32d76d19-8a05-4db0-9fc2-e0b0648fe9d0";

    private PipelineFixtures() {
    }

    public static QueuedJob job(ObjectMapper objectMapper, QueueName queue, String id, Object payload) {
        return new QueuedJob(id, queue, JobPayloads.toJson(objectMapper, payload), 0, 0,
            queue.getRetryPolicy(), NOW, null);
    }

    public static QueuedJob emptyJob(ObjectMapper objectMapper, QueueName queue, String id) {
        ObjectNode empty = objectMapper.createObjectNode();
        return new QueuedJob(id, queue, empty, 0, 0, queue.getRetryPolicy(), NOW, null);
    }

    public static SeriesSource mangaDexSource(String id, SyncPriority tier, int failureCount) {
        return SeriesSource.builder()
            .id(id)
            .seriesId("0190a0c8-0000-7000-8000-000000000001")
            .sourceName("mangadex")
            .sourceId(MANGADEX_ID)
            .sourceUrl("https://mangadex.org/title/" + MANGADEX_ID)
            .syncPriority(tier)
            .failureCount(failureCount)
            .build();
    }

    public static SeriesCandidate candidate(String externalId, String title) {
        return SeriesCandidate.builder()
            .title(title)
            .sourceName("mangadex")
            .sourceId(externalId)
            .sourceUrl("https://mangadex.org/title/" + externalId)
            .externalId(externalId)
            .alternativeTitles(List.of())
            .genres(List.of())
            .confidence(100.0)
            .score(1)
            .build();
    }
}
