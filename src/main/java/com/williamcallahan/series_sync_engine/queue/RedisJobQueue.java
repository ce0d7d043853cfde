/**
 * Redis-backed job queue shared by every producer and worker process
 *
 * @author William Callahan
 *
 * Features:
 * - One string key per unfinished job; SET NX on that key is the dedup guard
 * - Waiting jobs in a sorted set scored by priority, then enqueue time
 * - Delayed retries and active leases in sorted sets scored by due time
 * - Completed and failed history trimmed by count and age on every write
 * - Multi-key transitions run as Lua scripts so a crash never half-applies them
 */

package com.williamcallahan.series_sync_engine.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.series_sync_engine.exception.PipelineException;
import com.williamcallahan.series_sync_engine.util.RedisHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class RedisJobQueue implements JobQueue {

    private static final Logger logger = LoggerFactory.getLogger(RedisJobQueue.class);

    /** Spacing between priority bands in the waiting set score. */
    static final double PRIORITY_BAND = 1e13;
    private static final int PROMOTE_BATCH = 100;

    static final String ENQUEUE_SCRIPT = """
        if redis.call('SET', KEYS[1], ARGV[1], 'NX') then
          redis.call('ZADD', KEYS[2], ARGV[2], ARGV[3])
          return 1
        end
        return 0
        """;

    static final String POLL_SCRIPT = """
        local popped = redis.call('ZPOPMIN', KEYS[1])
        if #popped == 0 then return nil end
        local id = popped[1]
        local json = redis.call('GET', ARGV[2] .. id)
        if not json then return {id} end
        redis.call('ZADD', KEYS[2], ARGV[1], id)
        return {id, json}
        """;

    static final String PROMOTE_SCRIPT = """
        local due = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, tonumber(ARGV[3]))
        local moved = 0
        for _, id in ipairs(due) do
          redis.call('ZREM', KEYS[1], id)
          local json = redis.call('GET', ARGV[2] .. id)
          if json then
            local job = cjson.decode(json)
            redis.call('ZADD', KEYS[2], job.priority * 10000000000000 + tonumber(ARGV[1]), id)
            moved = moved + 1
          end
        end
        return moved
        """;

    static final String FINISH_SCRIPT = """
        redis.call('ZREM', KEYS[1], ARGV[1])
        redis.call('DEL', KEYS[2])
        redis.call('ZADD', KEYS[3], ARGV[2], ARGV[3])
        redis.call('ZREMRANGEBYSCORE', KEYS[3], '-inf', '(' .. ARGV[4])
        redis.call('ZREMRANGEBYRANK', KEYS[3], 0, -(tonumber(ARGV[5]) + 1))
        return 1
        """;

    static final String RETRY_SCRIPT = """
        redis.call('ZREM', KEYS[1], ARGV[1])
        redis.call('SET', KEYS[2], ARGV[2])
        redis.call('ZADD', KEYS[3], ARGV[3], ARGV[1])
        return 1
        """;

    static final String RELEASE_SCRIPT = """
        if redis.call('ZREM', KEYS[1], ARGV[1]) == 1 then
          redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1])
          return 1
        end
        return 0
        """;

    private final JedisPooled jedis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisJobQueue(JedisPooled jedis, ObjectMapper objectMapper, Clock clock, String keyPrefix) {
        this.jedis = jedis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean enqueue(JobRequest request) {
        QueuedJob job = QueuedJob.from(request, clock.instant());
        String json = serialize(job, null);
        Object result = jedis.eval(ENQUEUE_SCRIPT,
            List.of(jobKey(job.queue(), job.id()), key(job.queue(), "wait")),
            List.of(json, String.valueOf(waitScore(job.priority(), clock.millis())), job.id()));
        boolean added = Long.valueOf(1L).equals(result);
        if (!added) {
            logger.debug("Skipping duplicate job {} on {}", job.id(), job.queue().getKey());
        }
        return added;
    }

    @Override
    public Optional<QueuedJob> poll(QueueName queue, Duration lease) {
        long leaseUntil = clock.millis() + lease.toMillis();
        Object result = jedis.eval(POLL_SCRIPT,
            List.of(key(queue, "wait"), key(queue, "active")),
            List.of(String.valueOf(leaseUntil), jobKeyPrefix(queue)));
        if (!(result instanceof List<?> reply) || reply.isEmpty()) {
            return Optional.empty();
        }
        String id = String.valueOf(reply.get(0));
        if (reply.size() < 2) {
            logger.warn("Dropping orphaned job id {} on {}: job record missing", id, queue.getKey());
            return Optional.empty();
        }
        Optional<QueuedJob> job = deserialize(String.valueOf(reply.get(1)));
        if (job.isEmpty()) {
            jedis.zrem(key(queue, "active"), id);
            jedis.del(jobKey(queue, id));
        }
        return job;
    }

    @Override
    public void complete(QueuedJob job) {
        finish(job, "completed", job.queue().getCompletedRetention());
    }

    @Override
    public JobFailureOutcome fail(QueuedJob job, Throwable error) {
        int attempts = job.attemptsMade() + 1;
        QueuedJob failed = job.withFailure(attempts, InMemoryJobQueue.describe(error));

        if (PipelineException.isRetryable(error) && job.retryPolicy().allowsRetryAfter(attempts)) {
            long readyAt = clock.millis() + job.retryPolicy().backoffFor(attempts).toMillis();
            jedis.eval(RETRY_SCRIPT,
                List.of(key(job.queue(), "active"), jobKey(job.queue(), job.id()), key(job.queue(), "delayed")),
                List.of(job.id(), serialize(failed, null), String.valueOf(readyAt)));
            return JobFailureOutcome.RETRY_SCHEDULED;
        }

        finish(failed, "failed", job.queue().getFailedRetention());
        return JobFailureOutcome.FAILED;
    }

    @Override
    public void release(QueuedJob job) {
        jedis.eval(RELEASE_SCRIPT,
            List.of(key(job.queue(), "active"), key(job.queue(), "wait")),
            List.of(job.id(), String.valueOf(waitScore(job.priority(), job.enqueuedAt().toEpochMilli()))));
    }

    @Override
    public int promoteDelayed(QueueName queue, Instant now) {
        return moveDue(queue, "delayed", now);
    }

    @Override
    public int requeueStalled(QueueName queue, Instant now) {
        int moved = moveDue(queue, "active", now);
        if (moved > 0) {
            logger.warn("Requeued {} stalled job(s) on {}", moved, queue.getKey());
        }
        return moved;
    }

    @Override
    public QueueCounts counts(QueueName queue) {
        long now = clock.millis();
        long completedCutoff = now - queue.getCompletedRetention().maxAge().toMillis();
        long failedCutoff = now - queue.getFailedRetention().maxAge().toMillis();
        return new QueueCounts(
            jedis.zcard(key(queue, "wait")),
            jedis.zcard(key(queue, "active")),
            jedis.zcard(key(queue, "delayed")),
            jedis.zcount(key(queue, "completed"), completedCutoff, Double.POSITIVE_INFINITY),
            jedis.zcount(key(queue, "failed"), failedCutoff, Double.POSITIVE_INFINITY));
    }

    @Override
    public List<QueuedJob> recentFailures(QueueName queue, int limit) {
        List<QueuedJob> result = new ArrayList<>();
        for (String entry : jedis.zrevrange(key(queue, "failed"), 0, Math.max(limit - 1, 0))) {
            deserialize(entry).ifPresent(result::add);
        }
        return result;
    }

    private int moveDue(QueueName queue, String from, Instant now) {
        Object moved = jedis.eval(PROMOTE_SCRIPT,
            List.of(key(queue, from), key(queue, "wait")),
            List.of(String.valueOf(now.toEpochMilli()), jobKeyPrefix(queue), String.valueOf(PROMOTE_BATCH)));
        return moved instanceof Long count ? count.intValue() : 0;
    }

    private void finish(QueuedJob job, String history, RetentionPolicy retention) {
        long now = clock.millis();
        long cutoff = now - retention.maxAge().toMillis();
        jedis.eval(FINISH_SCRIPT,
            List.of(key(job.queue(), "active"), jobKey(job.queue(), job.id()), key(job.queue(), history)),
            List.of(job.id(), String.valueOf(now), serialize(job, now), String.valueOf(cutoff),
                String.valueOf(retention.maxCount())));
    }

    static double waitScore(int priority, long enqueuedAtMillis) {
        return priority * PRIORITY_BAND + enqueuedAtMillis;
    }

    String key(QueueName queue, String suffix) {
        return RedisHelper.queueKey(keyPrefix, queue.getKey(), suffix);
    }

    String jobKey(QueueName queue, String id) {
        return jobKeyPrefix(queue) + id;
    }

    private String jobKeyPrefix(QueueName queue) {
        return key(queue, "job:");
    }

    String serialize(QueuedJob job, Long finishedAt) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", job.id());
        node.put("queue", job.queue().getKey());
        node.set("payload", job.payload());
        node.put("priority", job.priority());
        node.put("attemptsMade", job.attemptsMade());
        node.put("maxAttempts", job.retryPolicy().maxAttempts());
        node.put("baseDelayMs", job.retryPolicy().baseDelay().toMillis());
        node.put("maxDelayMs", job.retryPolicy().maxDelay().toMillis());
        node.put("enqueuedAt", job.enqueuedAt().toEpochMilli());
        if (job.lastError() != null) {
            node.put("lastError", job.lastError());
        }
        if (finishedAt != null) {
            node.put("finishedAt", finishedAt);
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job " + job.id(), e);
        }
    }

    Optional<QueuedJob> deserialize(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            Optional<QueueName> queue = QueueName.fromKey(node.path("queue").asText());
            if (queue.isEmpty()) {
                logger.error("Discarding job with unknown queue: {}", json);
                return Optional.empty();
            }
            RetryPolicy policy = new RetryPolicy(
                node.path("maxAttempts").asInt(queue.get().getRetryPolicy().maxAttempts()),
                Duration.ofMillis(node.path("baseDelayMs").asLong(queue.get().getRetryPolicy().baseDelay().toMillis())),
                Duration.ofMillis(node.path("maxDelayMs").asLong(queue.get().getRetryPolicy().maxDelay().toMillis())));
            return Optional.of(new QueuedJob(
                node.path("id").asText(),
                queue.get(),
                node.get("payload"),
                node.path("priority").asInt(JobRequest.DEFAULT_PRIORITY),
                node.path("attemptsMade").asInt(0),
                policy,
                Instant.ofEpochMilli(node.path("enqueuedAt").asLong(0L)),
                node.hasNonNull("lastError") ? node.get("lastError").asText() : null));
        } catch (JsonProcessingException e) {
            logger.error("Discarding unparseable job record: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
