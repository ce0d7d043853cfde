/**
 * Rate limiters for queues whose jobs call external services
 * - Sync jobs scrape source sites
 * - Discovery jobs page through the external catalog
 * - Non-blocking: a worker without a permit leaves the job waiting for the next poll
 *
 * @author William Callahan
 */
package com.williamcallahan.series_sync_engine.config;

import com.williamcallahan.series_sync_engine.queue.QueueName;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class WorkerRateLimiterConfig {

    private static final Logger logger = LoggerFactory.getLogger(WorkerRateLimiterConfig.class);

    /**
     * Limits sync jobs started per second across this process.
     *
     * @return rate limiter for the sync queue
     */
    @Bean
    public RateLimiter syncSourceRateLimiter(PipelineProperties properties) {
        return perSecond(QueueName.SYNC_SOURCE, properties.getWorker().ratePerSecondFor(QueueName.SYNC_SOURCE));
    }

    /**
     * Limits discovery jobs started per second across this process.
     *
     * @return rate limiter for the discovery queue
     */
    @Bean
    public RateLimiter checkSourceRateLimiter(PipelineProperties properties) {
        return perSecond(QueueName.CHECK_SOURCE, properties.getWorker().ratePerSecondFor(QueueName.CHECK_SOURCE));
    }

    static RateLimiter perSecond(QueueName queue, int jobsPerSecond) {
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .limitForPeriod(Math.max(1, jobsPerSecond))
            .timeoutDuration(Duration.ZERO)
            .build();
        RateLimiter rateLimiter = RateLimiter.of(queue.getKey() + "RateLimiter", config);
        logger.info("Rate limiter for queue {} initialized with {} job(s)/second", queue.getKey(), jobsPerSecond);
        return rateLimiter;
    }
}
