/**
 * Configuration for graceful application shutdown handling
 *
 * @author William Callahan
 *
 * Features:
 * - Flags shutdown so the master scheduler stops enqueueing
 * - Stops workers from claiming jobs, then waits for in-flight jobs up to a bound
 * - Closes the Redis pool only after workers drained
 */

package com.williamcallahan.series_sync_engine.config;

import com.williamcallahan.series_sync_engine.queue.WorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import redis.clients.jedis.JedisPooled;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdownConfig.class);
    private static final AtomicBoolean shutdownInitiated = new AtomicBoolean(false);
    private static final long DRAIN_POLL_MILLIS = 200;

    private final ApplicationContext applicationContext;
    private final ObjectProvider<WorkerRuntime> workerRuntime;
    private final ObjectProvider<JedisPooled> jedisPooled;
    private final PipelineProperties properties;

    public GracefulShutdownConfig(ApplicationContext applicationContext,
                                  ObjectProvider<WorkerRuntime> workerRuntime,
                                  ObjectProvider<JedisPooled> jedisPooled,
                                  PipelineProperties properties) {
        this.applicationContext = applicationContext;
        this.workerRuntime = workerRuntime;
        this.jedisPooled = jedisPooled;
        this.properties = properties;
    }

    /**
     * Check if shutdown has been initiated
     */
    public static boolean isShuttingDown() {
        return shutdownInitiated.get();
    }

    @Override
    public void onApplicationEvent(@NonNull ContextClosedEvent event) {
        if (event.getApplicationContext() != applicationContext) {
            return;
        }
        if (shutdownInitiated.compareAndSet(false, true)) {
            logger.info("Application shutdown event received - initiating graceful shutdown");
            drainAndClose();
            logger.info("Graceful shutdown completed");
        }
    }

    /**
     * Runs the shutdown phases in order.
     *
     * @return true when every in-flight job finished before the timeout
     */
    boolean drainAndClose() {
        WorkerRuntime runtime = workerRuntime.getIfAvailable();
        boolean drained = true;
        if (runtime != null) {
            logger.info("Phase 1: Stopping job claims");
            runtime.stopAccepting();

            logger.info("Phase 2: Waiting for in-flight jobs");
            drained = awaitDrain(runtime, properties.getWorker().getShutdownTimeout());
            runtime.shutdownExecutors();
        }

        logger.info("Phase 3: Closing Redis connections");
        closeRedisConnections();
        return drained;
    }

    private boolean awaitDrain(WorkerRuntime runtime, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int inFlight = runtime.inFlight();
        while (inFlight > 0 && System.nanoTime() < deadline) {
            logger.info("{} job(s) still in flight", inFlight);
            try {
                Thread.sleep(DRAIN_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for in-flight jobs");
                return false;
            }
            inFlight = runtime.inFlight();
        }
        if (inFlight > 0) {
            logger.warn("{} job(s) still running after {}; their leases will expire and they will be retried",
                inFlight, timeout);
            return false;
        }
        return true;
    }

    private void closeRedisConnections() {
        JedisPooled jedis = jedisPooled.getIfAvailable();
        if (jedis == null) {
            return;
        }
        try {
            jedis.close();
            logger.info("Redis connection pool closed");
        } catch (Exception e) {
            logger.error("Error closing Redis connections", e);
        }
    }
}
