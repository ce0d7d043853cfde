/**
 * Reads and writes the worker liveness heartbeat
 *
 * @author William Callahan
 *
 * Features:
 * - Workers write the current epoch millis under a short-lived key
 * - Producers read the age of the newest heartbeat
 * - Missing or unparseable heartbeats read as absent
 */

package com.williamcallahan.series_sync_engine.service;

import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import com.williamcallahan.series_sync_engine.service.cache.CoordinationStore;
import com.williamcallahan.series_sync_engine.util.RedisHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

@Service
public class WorkerHeartbeatService {

    private static final Logger logger = LoggerFactory.getLogger(WorkerHeartbeatService.class);

    private final CoordinationStore coordinationStore;
    private final PipelineProperties properties;
    private final Clock clock;

    public WorkerHeartbeatService(CoordinationStore coordinationStore, PipelineProperties properties, Clock clock) {
        this.coordinationStore = coordinationStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Publishes a heartbeat stamped with the current time.
     */
    public void beat() {
        coordinationStore.set(RedisHelper.heartbeatKey(), String.valueOf(clock.millis()),
            properties.getWorker().getHeartbeatTtl());
    }

    /**
     * @return age of the latest heartbeat, empty when none is stored
     */
    public Optional<Duration> heartbeatAge() {
        Optional<String> stored = coordinationStore.get(RedisHelper.heartbeatKey());
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            long beatAt = Long.parseLong(stored.get().trim());
            return Optional.of(Duration.ofMillis(Math.max(0, clock.millis() - beatAt)));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed worker heartbeat value '{}'", stored.get());
            return Optional.empty();
        }
    }
}
