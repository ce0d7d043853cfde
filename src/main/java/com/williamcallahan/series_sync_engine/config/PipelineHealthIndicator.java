/**
 * Actuator health indicator for the sync pipeline
 *
 * @author William Callahan
 *
 * Reports worker liveness and per-queue backlog; OUT_OF_SERVICE while
 * discovery requests would be refused
 */

package com.williamcallahan.series_sync_engine.config;

import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.QueueCounts;
import com.williamcallahan.series_sync_engine.queue.QueueName;
import com.williamcallahan.series_sync_engine.service.PipelineHealthGate;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component("pipelineHealthIndicator")
public class PipelineHealthIndicator implements HealthIndicator {

    private final PipelineHealthGate healthGate;
    private final JobQueue jobQueue;

    public PipelineHealthIndicator(PipelineHealthGate healthGate, JobQueue jobQueue) {
        this.healthGate = healthGate;
        this.jobQueue = jobQueue;
    }

    @Override
    public Health health() {
        boolean workersOnline = healthGate.areWorkersOnline();
        boolean discoveryHealthy = healthGate.isQueueHealthy(QueueName.CHECK_SOURCE);

        Map<String, Object> backlog = new LinkedHashMap<>();
        for (QueueName queue : QueueName.values()) {
            try {
                QueueCounts counts = jobQueue.counts(queue);
                backlog.put(queue.getKey(), counts.backlog());
            } catch (RuntimeException e) {
                backlog.put(queue.getKey(), "unavailable");
            }
        }

        Health.Builder builder = workersOnline && discoveryHealthy ? Health.up() : Health.outOfService();
        return builder
            .withDetail("workers_online", workersOnline)
            .withDetail("discovery_queue_healthy", discoveryHealthy)
            .withDetail("backlog", backlog)
            .build();
    }
}
