package com.williamcallahan.series_sync_engine.scheduler;

import com.williamcallahan.series_sync_engine.queue.WorkerRuntime;
import com.williamcallahan.series_sync_engine.service.WorkerHeartbeatService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Publishes the worker liveness heartbeat while this process is consuming jobs.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerHeartbeatScheduler {

    private static final Logger logger = LoggerFactory.getLogger(WorkerHeartbeatScheduler.class);

    private final WorkerRuntime workerRuntime;
    private final WorkerHeartbeatService heartbeatService;

    public WorkerHeartbeatScheduler(WorkerRuntime workerRuntime, WorkerHeartbeatService heartbeatService) {
        this.workerRuntime = workerRuntime;
        this.heartbeatService = heartbeatService;
    }

    @Scheduled(fixedRateString = "${app.pipeline.worker.heartbeat-interval-ms:5000}")
    public void beat() {
        if (!workerRuntime.isRunning()) {
            return;
        }
        try {
            heartbeatService.beat();
        } catch (RuntimeException e) {
            logger.warn("Failed to publish worker heartbeat: {}", e.getMessage());
        }
    }
}
