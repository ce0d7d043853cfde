/**
 * Queue handler reconciling one source link's chapters with its source
 *
 * @author William Callahan
 *
 * Features:
 * - Circuit breaker: links at the failure limit are parked COLD without any fetch
 * - Refuses to fetch URLs outside the known source hosts
 * - Inserts only unseen chapter numbers; re-running a sync inserts nothing
 * - Chapter inserts and link bookkeeping commit together
 * - Non-retryable scraper errors are recorded and end the job without a retry
 * - Hands newly found chapters to the notification queue
 */

package com.williamcallahan.series_sync_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.NotificationJobData;
import com.williamcallahan.series_sync_engine.dto.SyncSourceJobData;
import com.williamcallahan.series_sync_engine.exception.InvalidJobPayloadException;
import com.williamcallahan.series_sync_engine.exception.PipelineException;
import com.williamcallahan.series_sync_engine.model.Chapter;
import com.williamcallahan.series_sync_engine.model.SeriesSource;
import com.williamcallahan.series_sync_engine.queue.JobHandler;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.JobRequest;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.queue.QueuedJob;
import com.williamcallahan.series_sync_engine.repository.ChapterRepository;
import com.williamcallahan.series_sync_engine.repository.SeriesSourceRepository;
import com.williamcallahan.series_sync_engine.service.scraper.ScrapedChapter;
import com.williamcallahan.series_sync_engine.service.scraper.ScrapedSeries;
import com.williamcallahan.series_sync_engine.service.scraper.Scraper;
import com.williamcallahan.series_sync_engine.service.scraper.ScraperRegistry;
import com.williamcallahan.series_sync_engine.types.SourceHealth;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import com.williamcallahan.series_sync_engine.util.UrlUtils;
import com.williamcallahan.series_sync_engine.util.UuidUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Component
@Slf4j
public class SourceSyncWorker implements JobHandler {

    /** Matches the NUMERIC(10, 2) chapter_number column. */
    static final int CHAPTER_NUMBER_SCALE = 2;

    private final SeriesSourceRepository seriesSourceRepository;
    private final ChapterRepository chapterRepository;
    private final ScraperRegistry scraperRegistry;
    private final JobQueue jobQueue;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private TransactionTemplate transactionTemplate;

    public SourceSyncWorker(SeriesSourceRepository seriesSourceRepository,
                            ChapterRepository chapterRepository,
                            ScraperRegistry scraperRegistry,
                            JobQueue jobQueue,
                            PipelineProperties properties,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.seriesSourceRepository = seriesSourceRepository;
        this.chapterRepository = chapterRepository;
        this.scraperRegistry = scraperRegistry;
        this.jobQueue = jobQueue;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Autowired
    void setTransactionManager(@Nullable PlatformTransactionManager transactionManager) {
        if (transactionManager != null) {
            this.transactionTemplate = new TransactionTemplate(transactionManager);
        }
    }

    @Override
    public QueueName queue() {
        return QueueName.SYNC_SOURCE;
    }

    @Override
    public void handle(QueuedJob job) throws Exception {
        SyncSourceJobData data = JobPayloads.read(objectMapper, job, SyncSourceJobData.class);
        if (!UuidUtil.isUuid(data.seriesSourceId())) {
            throw new InvalidJobPayloadException(job.id(), "series_source_id must be a UUID");
        }

        Optional<SeriesSource> found = seriesSourceRepository.findById(data.seriesSourceId());
        if (found.isEmpty()) {
            log.warn("Source link {} no longer exists; dropping sync job {}", data.seriesSourceId(), job.id());
            return;
        }
        SeriesSource source = found.get();
        Instant now = clock.instant();

        if (source.health() == SourceHealth.CIRCUIT_OPEN) {
            Instant nextCheck = now.plus(properties.getSync().getCircuitCooldown());
            seriesSourceRepository.openCircuit(source.getId(), nextCheck);
            log.warn("Circuit open for {} {} after {} consecutive failures; next check at {}",
                source.getSourceName(), source.getSourceId(), source.getFailureCount(), nextCheck);
            return;
        }

        if (!UrlUtils.isAllowedSourceUrl(source.getSourceUrl())) {
            seriesSourceRepository.recordFailure(source.getId(), now);
            log.error("Refusing to sync {}: URL '{}' is not on an allowed host", source.getId(), source.getSourceUrl());
            return;
        }

        Optional<Scraper> scraper = scraperRegistry.forSource(source.getSourceName());
        if (scraper.isEmpty()) {
            log.error("No scraper for source '{}'; skipping link {}", source.getSourceName(), source.getId());
            return;
        }

        int inserted;
        try {
            ScrapedSeries scraped = scraper.get().fetchChapters(source.getSourceId());
            inserted = inTransaction(() -> reconcile(source, scraped, now));
        } catch (Exception ex) {
            seriesSourceRepository.recordFailure(source.getId(), now);
            if (PipelineException.isRetryable(ex)) {
                LoggingUtils.warn(log, ex, "Sync of {} {} failed (failure #{})",
                    source.getSourceName(), source.getSourceId(), source.getFailureCount() + 1);
                throw ex;
            }
            log.warn("Sync of {} {} failed permanently, not retrying: {}",
                source.getSourceName(), source.getSourceId(), ex.getMessage());
            return;
        }

        log.info("Synced {} {}: {} new chapter(s)", source.getSourceName(), source.getSourceId(), inserted);
        if (inserted > 0) {
            enqueueNotification(source, inserted, now);
        }
    }

    private int reconcile(SeriesSource source, ScrapedSeries scraped, Instant now) {
        Set<BigDecimal> known = chapterRepository.findChapterNumbers(source.getId()).stream()
            .map(SourceSyncWorker::normalize)
            .collect(Collectors.toSet());

        Map<BigDecimal, Chapter> fresh = new LinkedHashMap<>();
        for (ScrapedChapter chapter : scraped.chapters()) {
            if (chapter.number() == null) {
                continue;
            }
            BigDecimal number = normalize(chapter.number());
            if (known.contains(number)) {
                continue;
            }
            fresh.putIfAbsent(number, new Chapter(source.getSeriesId(), source.getId(), number,
                chapter.title(), chapter.url(), chapter.publishedAt()));
        }

        int inserted = chapterRepository.insertIgnoringDuplicates(new ArrayList<>(fresh.values()));
        seriesSourceRepository.recordSuccess(source.getId(), now, inserted);
        return inserted;
    }

    private void enqueueNotification(SeriesSource source, int inserted, Instant now) {
        try {
            NotificationJobData payload = new NotificationJobData(source.getSeriesId(), source.getId(), inserted);
            jobQueue.enqueue(JobRequest.of(QueueName.NOTIFICATIONS,
                "notify-" + source.getSeriesId() + "-" + now.toEpochMilli(),
                JobPayloads.toJson(objectMapper, payload)));
        } catch (RuntimeException e) {
            // Chapters are already committed, so the job must still complete
            LoggingUtils.error(log, e, "Failed to enqueue new-chapter notification for series {}", source.getSeriesId());
        }
    }

    /**
     * Rounds to the two decimals the chapters table stores, then treats 1, 1.0 and 1.00 as the same chapter.
     */
    static BigDecimal normalize(BigDecimal number) {
        BigDecimal stripped = number.setScale(CHAPTER_NUMBER_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private <T> T inTransaction(Supplier<T> work) {
        if (transactionTemplate != null) {
            return transactionTemplate.execute(status -> work.get());
        }
        return work.get();
    }
}
