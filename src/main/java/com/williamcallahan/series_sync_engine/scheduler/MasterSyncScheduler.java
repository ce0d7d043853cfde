/**
 * Periodic tick turning due source links into sync jobs
 * - Picks up links whose next check is due or was never scheduled
 * - One bulk enqueue per tick, prioritized by tier
 * - Pushes each link's next check out by its tier interval
 *
 * @author William Callahan
 */
package com.williamcallahan.series_sync_engine.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.config.GracefulShutdownConfig;
import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.dto.SyncSourceJobData;
import com.williamcallahan.series_sync_engine.model.SeriesSource;
import com.williamcallahan.series_sync_engine.queue.JobPayloads;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.JobRequest;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.repository.SeriesSourceRepository;
import com.williamcallahan.series_sync_engine.types.SyncPriority;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MasterSyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MasterSyncScheduler.class);

    private final SeriesSourceRepository seriesSourceRepository;
    private final JobQueue jobQueue;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MasterSyncScheduler(SeriesSourceRepository seriesSourceRepository,
                               JobQueue jobQueue,
                               PipelineProperties properties,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.seriesSourceRepository = seriesSourceRepository;
        this.jobQueue = jobQueue;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Scheduled entry point; also fires once shortly after startup.
     */
    @Scheduled(fixedDelayString = "${app.pipeline.scheduler.interval-ms:300000}",
               initialDelayString = "${app.pipeline.scheduler.initial-delay-ms:0}")
    public void tick() {
        if (!properties.getScheduler().isEnabled()) {
            logger.debug("Master sync scheduler is disabled");
            return;
        }
        if (GracefulShutdownConfig.isShuttingDown()) {
            logger.debug("Skipping master sync tick during shutdown");
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            LoggingUtils.error(logger, e, "Master sync tick failed");
        }
    }

    /**
     * Enqueues sync jobs for every due link in one batch.
     *
     * @return what the tick did
     */
    public TickSummary runOnce() {
        Instant now = clock.instant();
        List<SeriesSource> due = seriesSourceRepository.findDueForSync(now, properties.getScheduler().getBatchSize());
        if (due.isEmpty()) {
            return TickSummary.EMPTY;
        }

        Map<SyncPriority, List<String>> idsByTier = new EnumMap<>(SyncPriority.class);
        List<JobRequest> jobs = new ArrayList<>(due.size());
        for (SeriesSource source : due) {
            SyncPriority tier = source.getSyncPriority() != null ? source.getSyncPriority() : SyncPriority.COLD;
            idsByTier.computeIfAbsent(tier, t -> new ArrayList<>()).add(source.getId());
            jobs.add(JobRequest.of(QueueName.SYNC_SOURCE,
                "sync-" + source.getId() + "-" + now.toEpochMilli(),
                JobPayloads.toJson(objectMapper, new SyncSourceJobData(source.getId())),
                tier.getQueueRank()));
        }

        int enqueued = jobQueue.enqueueBulk(jobs);
        idsByTier.forEach((tier, ids) -> seriesSourceRepository.scheduleNextCheck(ids, now.plus(tier.getInterval())));

        logger.info("Master sync tick: {} due link(s), {} job(s) enqueued (HOT={}, WARM={}, COLD={})",
            due.size(), enqueued,
            idsByTier.getOrDefault(SyncPriority.HOT, List.of()).size(),
            idsByTier.getOrDefault(SyncPriority.WARM, List.of()).size(),
            idsByTier.getOrDefault(SyncPriority.COLD, List.of()).size());
        return new TickSummary(due.size(), enqueued);
    }

    /**
     * @param due links found due
     * @param enqueued jobs actually added (duplicates excluded)
     */
    public record TickSummary(int due, int enqueued) {
        public static final TickSummary EMPTY = new TickSummary(0, 0);
    }
}
