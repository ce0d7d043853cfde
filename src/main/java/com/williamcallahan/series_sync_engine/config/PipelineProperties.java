package com.williamcallahan.series_sync_engine.config;

import com.williamcallahan.series_sync_engine.queue.QueueName;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Strongly typed configuration for the sync pipeline.
 */
@Component
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * Namespace prepended to every Redis key the pipeline owns.
     */
    private String keyPrefix = "kenmei:";

    private final Scheduler scheduler = new Scheduler();
    private final Worker worker = new Worker();
    private final Gate gate = new Gate();
    private final Discovery discovery = new Discovery();
    private final Sync sync = new Sync();
    private final Notifications notifications = new Notifications();
    private final Catalog catalog = new Catalog();

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Worker getWorker() {
        return worker;
    }

    public Gate getGate() {
        return gate;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public Sync getSync() {
        return sync;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public static class Scheduler {

        /**
         * Whether the master sync tick runs in this process.
         */
        private boolean enabled = true;

        /**
         * Maximum number of due source links enqueued per tick.
         */
        private int batchSize = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Worker {

        /**
         * Whether queue consumers run in this process.
         */
        private boolean enabled = true;

        /**
         * How long a claimed job may run before another worker may reclaim it.
         */
        private Duration jobLease = Duration.ofMinutes(5);

        /**
         * Expiry of the liveness heartbeat key.
         */
        private Duration heartbeatTtl = Duration.ofSeconds(10);

        /**
         * Upper bound on waiting for in-flight jobs during shutdown.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        /**
         * Per-queue concurrency overrides; queues not listed use their defaults.
         */
        private Map<QueueName, Integer> concurrency = new EnumMap<>(QueueName.class);

        /**
         * Per-queue jobs-per-second overrides; 0 disables limiting.
         */
        private Map<QueueName, Integer> ratePerSecond = new EnumMap<>(QueueName.class);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getJobLease() {
            return jobLease;
        }

        public void setJobLease(Duration jobLease) {
            this.jobLease = jobLease;
        }

        public Duration getHeartbeatTtl() {
            return heartbeatTtl;
        }

        public void setHeartbeatTtl(Duration heartbeatTtl) {
            this.heartbeatTtl = heartbeatTtl;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Map<QueueName, Integer> getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(Map<QueueName, Integer> concurrency) {
            this.concurrency = concurrency;
        }

        public Map<QueueName, Integer> getRatePerSecond() {
            return ratePerSecond;
        }

        public void setRatePerSecond(Map<QueueName, Integer> ratePerSecond) {
            this.ratePerSecond = ratePerSecond;
        }

        public int concurrencyFor(QueueName queue) {
            return Math.max(1, concurrency.getOrDefault(queue, queue.getDefaultConcurrency()));
        }

        public int ratePerSecondFor(QueueName queue) {
            return Math.max(0, ratePerSecond.getOrDefault(queue, queue.getDefaultRatePerSecond()));
        }
    }

    public static class Gate {

        /**
         * Heartbeats older than this mean no worker is alive.
         */
        private Duration heartbeatStaleness = Duration.ofSeconds(15);

        /**
         * Discovery backlog (waiting + active + delayed) at which new requests are refused.
         */
        private long maxBacklog = 5000;

        public Duration getHeartbeatStaleness() {
            return heartbeatStaleness;
        }

        public void setHeartbeatStaleness(Duration heartbeatStaleness) {
            this.heartbeatStaleness = heartbeatStaleness;
        }

        public long getMaxBacklog() {
            return maxBacklog;
        }

        public void setMaxBacklog(long maxBacklog) {
            this.maxBacklog = maxBacklog;
        }
    }

    public static class Discovery {

        /**
         * Quiet period per client and query after a discovery request.
         */
        private Duration cooldown = Duration.ofSeconds(30);

        /**
         * Catalog results requested per page.
         */
        private int pageLimit = 32;

        /**
         * Maximum catalog pages fetched per discovery job.
         */
        private int maxPages = 3;

        /**
         * Longest accepted query, in characters.
         */
        private int maxQueryLength = 200;

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public int getPageLimit() {
            return pageLimit;
        }

        public void setPageLimit(int pageLimit) {
            this.pageLimit = pageLimit;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public int getMaxQueryLength() {
            return maxQueryLength;
        }

        public void setMaxQueryLength(int maxQueryLength) {
            this.maxQueryLength = maxQueryLength;
        }
    }

    public static class Sync {

        /**
         * Timeout for one scraper fetch.
         */
        private Duration scrapeTimeout = Duration.ofSeconds(30);

        /**
         * How long a link with an open circuit waits before its next check.
         */
        private Duration circuitCooldown = Duration.ofHours(24);

        public Duration getScrapeTimeout() {
            return scrapeTimeout;
        }

        public void setScrapeTimeout(Duration scrapeTimeout) {
            this.scrapeTimeout = scrapeTimeout;
        }

        public Duration getCircuitCooldown() {
            return circuitCooldown;
        }

        public void setCircuitCooldown(Duration circuitCooldown) {
            this.circuitCooldown = circuitCooldown;
        }
    }

    public static class Notifications {

        /**
         * A user gets at most one new-chapter notification per series within this window.
         */
        private Duration dedupWindow = Duration.ofMinutes(5);

        public Duration getDedupWindow() {
            return dedupWindow;
        }

        public void setDedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
        }
    }

    public static class Catalog {

        /**
         * Base URL of the MangaDex API.
         */
        private String baseUrl = "https://api.mangadex.org";

        /**
         * Base URL cover file names are resolved against.
         */
        private String coverBaseUrl = "https://uploads.mangadex.org/covers";

        /**
         * Public title page prefix used for source URLs.
         */
        private String titleBaseUrl = "https://mangadex.org/title";

        /**
         * Timeout for one catalog search request.
         */
        private Duration timeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCoverBaseUrl() {
            return coverBaseUrl;
        }

        public void setCoverBaseUrl(String coverBaseUrl) {
            this.coverBaseUrl = coverBaseUrl;
        }

        public String getTitleBaseUrl() {
            return titleBaseUrl;
        }

        public void setTitleBaseUrl(String titleBaseUrl) {
            this.titleBaseUrl = titleBaseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
