/**
 * Core pipeline beans shared by producers and workers
 *
 * @author William Callahan
 *
 * Features:
 * - UTC system clock, replaced by fixed clocks in tests
 * - In-memory job queue and coordination store when Redis is not configured
 */

package com.williamcallahan.series_sync_engine.config;

import com.williamcallahan.series_sync_engine.queue.InMemoryJobQueue;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.service.cache.CoordinationStore;
import com.williamcallahan.series_sync_engine.service.cache.InMemoryCoordinationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Conditional(RedisEnvironmentCondition.Absent.class)
    public JobQueue inMemoryJobQueue(Clock clock) {
        logger.warn("Using in-memory job queue; jobs do not survive a restart and are not shared across processes");
        return new InMemoryJobQueue(clock);
    }

    @Bean
    @Conditional(RedisEnvironmentCondition.Absent.class)
    public CoordinationStore inMemoryCoordinationStore() {
        return new InMemoryCoordinationStore();
    }
}
