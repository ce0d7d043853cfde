/**
 * Backpressure gate consulted before enqueueing user-triggered discovery work
 *
 * @author William Callahan
 *
 * Features:
 * - Workers count as online only with a fresh heartbeat
 * - Queue counts as healthy only below the configured backlog
 * - Any error while checking reads as unhealthy
 */

package com.williamcallahan.series_sync_engine.service;

import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.QueueCounts;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

@Service
public class PipelineHealthGate {

    private static final Logger logger = LoggerFactory.getLogger(PipelineHealthGate.class);

    private final WorkerHeartbeatService heartbeatService;
    private final JobQueue jobQueue;
    private final PipelineProperties properties;

    public PipelineHealthGate(WorkerHeartbeatService heartbeatService, JobQueue jobQueue, PipelineProperties properties) {
        this.heartbeatService = heartbeatService;
        this.jobQueue = jobQueue;
        this.properties = properties;
    }

    /**
     * @return true when a heartbeat younger than the staleness threshold exists
     */
    public boolean areWorkersOnline() {
        try {
            Optional<Duration> age = heartbeatService.heartbeatAge();
            return age.isPresent() && age.get().compareTo(properties.getGate().getHeartbeatStaleness()) < 0;
        } catch (RuntimeException e) {
            LoggingUtils.warn(logger, e, "Worker heartbeat check failed");
            return false;
        }
    }

    /**
     * @return true when waiting + active + delayed is below the configured backlog
     */
    public boolean isQueueHealthy(QueueName queue) {
        return isQueueHealthy(queue, properties.getGate().getMaxBacklog());
    }

    public boolean isQueueHealthy(QueueName queue, long maxBacklog) {
        try {
            QueueCounts counts = jobQueue.counts(queue);
            return counts.backlog() < maxBacklog;
        } catch (RuntimeException e) {
            LoggingUtils.warn(logger, e, "Queue health check failed for {}", queue.getKey());
            return false;
        }
    }

    /**
     * Combined check for discovery requests.
     */
    public boolean canEnqueueDiscovery() {
        return areWorkersOnline() && isQueueHealthy(QueueName.CHECK_SOURCE);
    }
}
