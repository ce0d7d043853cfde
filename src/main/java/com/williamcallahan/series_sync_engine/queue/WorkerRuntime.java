/**
 * Hosts one {@link QueueWorker} per registered {@link JobHandler}
 *
 * @author William Callahan
 *
 * Features:
 * - Starts consumers once the application is ready
 * - Dedicated bounded thread pool per queue
 * - Rate limiters for queues that hit external services
 * - Cooperates with graceful shutdown: stop claiming, drain, then close pools
 */

package com.williamcallahan.series_sync_engine.queue;

import com.williamcallahan.series_sync_engine.config.PipelineProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
@ConditionalOnProperty(prefix = "app.pipeline.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerRuntime {

    private static final Logger logger = LoggerFactory.getLogger(WorkerRuntime.class);

    private final JobQueue jobQueue;
    private final List<JobHandler> handlers;
    private final PipelineProperties properties;
    private final Map<QueueName, RateLimiter> rateLimiters = new EnumMap<>(QueueName.class);
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<QueueName, QueueWorker> workers = new EnumMap<>(QueueName.class);
    private final Map<QueueName, ThreadPoolTaskExecutor> executors = new EnumMap<>(QueueName.class);
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WorkerRuntime(JobQueue jobQueue,
                         List<JobHandler> handlers,
                         PipelineProperties properties,
                         @Qualifier("syncSourceRateLimiter") RateLimiter syncSourceRateLimiter,
                         @Qualifier("checkSourceRateLimiter") RateLimiter checkSourceRateLimiter,
                         Clock clock,
                         ObjectProvider<MeterRegistry> meterRegistry) {
        this.jobQueue = jobQueue;
        this.handlers = handlers;
        this.properties = properties;
        this.rateLimiters.put(QueueName.SYNC_SOURCE, syncSourceRateLimiter);
        this.rateLimiters.put(QueueName.CHECK_SOURCE, checkSourceRateLimiter);
        this.clock = clock;
        this.meterRegistry = meterRegistry.getIfAvailable();
    }

    /**
     * Creates executors and consumers for every handler. Safe to call once.
     */
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        PipelineProperties.Worker config = properties.getWorker();
        for (JobHandler handler : handlers) {
            QueueName queue = handler.queue();
            if (workers.containsKey(queue)) {
                throw new IllegalStateException("More than one handler registered for queue " + queue.getKey());
            }
            int concurrency = config.concurrencyFor(queue);
            ThreadPoolTaskExecutor executor = newExecutor(queue, concurrency);
            executors.put(queue, executor);
            RateLimiter limiter = config.ratePerSecondFor(queue) > 0 ? rateLimiters.get(queue) : null;
            workers.put(queue, new QueueWorker(jobQueue, handler, concurrency, limiter, executor,
                clock, config.getJobLease(), meterRegistry));
            logger.info("Worker started for queue {} (concurrency={}, rateLimited={})",
                queue.getKey(), concurrency, limiter != null);
        }
    }

    /**
     * Claim round for every queue. Each worker dispatches to its own pool, so this stays short.
     */
    @Scheduled(fixedDelayString = "${app.pipeline.worker.poll-interval-ms:250}")
    public void pollAll() {
        if (!running.get()) {
            return;
        }
        for (QueueWorker worker : workers.values()) {
            try {
                worker.pollOnce();
            } catch (RuntimeException e) {
                logger.warn("Poll of queue {} failed: {}", worker.queue().getKey(), e.getMessage());
            }
        }
    }

    /**
     * Stops claiming new jobs; in-flight jobs keep running.
     */
    public void stopAccepting() {
        running.set(false);
        workers.values().forEach(QueueWorker::stopAccepting);
    }

    public int inFlight() {
        return workers.values().stream().mapToInt(QueueWorker::inFlight).sum();
    }

    /**
     * Shuts the per-queue pools down, waiting for running tasks up to the configured timeout.
     */
    public void shutdownExecutors() {
        executors.forEach((queue, executor) -> {
            executor.shutdown();
            logger.debug("Executor for {} shut down", queue.getKey());
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    public Map<QueueName, QueueWorker> workers() {
        return Collections.unmodifiableMap(workers);
    }

    private ThreadPoolTaskExecutor newExecutor(QueueName queue, int concurrency) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(concurrency);
        executor.setThreadNamePrefix("worker-" + queue.getKey() + "-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getWorker().getShutdownTimeout().toSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
