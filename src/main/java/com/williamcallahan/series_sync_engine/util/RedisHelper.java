/**
 * Utility class for Redis operations and key layout
 * Provides centralized Redis exception handling and the key naming used by the pipeline
 *
 * @author William Callahan
 *
 * Features:
 * - Unified error handling for Redis operations
 * - Single place defining coordination and queue key names
 */

package com.williamcallahan.series_sync_engine.util;

import org.slf4j.Logger;
import redis.clients.jedis.exceptions.JedisException;

import java.util.function.Supplier;

public final class RedisHelper {

    // Redis key fragments, appended to the configured namespace prefix
    private static final String HEARTBEAT_KEY = "workers:heartbeat";
    private static final String SEARCH_COOLDOWN_PREFIX = "cooldown:search:";
    private static final String QUEUE_PREFIX = "queue:";

    private RedisHelper() {
    }

    /**
     * Executes a Redis operation with unified error handling
     *
     * @param log         SLF4J Logger to record warnings
     * @param jedisCall   Supplier performing the Jedis call
     * @param operation   Description of the Redis operation (for logging)
     * @param fallback    Value to return on exception
     * @param <T>         Return type
     * @return Result of jedisCall.get(), or fallback if an exception occurs
     */
    public static <T> T execute(Logger log, Supplier<T> jedisCall, String operation, T fallback) {
        try {
            return jedisCall.get();
        } catch (JedisException e) {
            log.warn("Redis {} failed ({}): {}", operation, e.getClass().getSimpleName(), e.getMessage());
            return fallback;
        }
    }

    /**
     * Key of the worker liveness heartbeat
     * @return the key, without namespace prefix
     */
    public static String heartbeatKey() {
        return HEARTBEAT_KEY;
    }

    /**
     * Key guarding repeated discovery requests from one client for one query
     * @param clientKey caller identity, usually the remote address
     * @param queryHash hash of the canonical query
     * @return the key, without namespace prefix
     */
    public static String searchCooldownKey(String clientKey, String queryHash) {
        return SEARCH_COOLDOWN_PREFIX + clientKey + ":" + queryHash;
    }

    /**
     * Key of one structure belonging to a named queue
     * @param prefix namespace prefix, e.g. {@code kenmei:}
     * @param queue queue key
     * @param suffix structure name
     * @return the fully prefixed key
     */
    public static String queueKey(String prefix, String queue, String suffix) {
        return prefix + QUEUE_PREFIX + queue + ":" + suffix;
    }
}
