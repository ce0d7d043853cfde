/**
 * Redis implementation of {@link CoordinationStore}
 *
 * @author William Callahan
 *
 * Features:
 * - All keys namespaced with the configured prefix
 * - Expiry applied in the same command as the write
 * - Reads degrade to empty on Redis errors, writes propagate
 */

package com.williamcallahan.series_sync_engine.service.cache;

import com.williamcallahan.series_sync_engine.util.RedisHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.Optional;

public class RedisCoordinationStore implements CoordinationStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCoordinationStore.class);

    private final JedisPooled jedisPooled;
    private final String keyPrefix;

    public RedisCoordinationStore(JedisPooled jedisPooled, String keyPrefix) {
        this.jedisPooled = jedisPooled;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<String> get(String key) {
        return RedisHelper.execute(logger,
            () -> Optional.ofNullable(jedisPooled.get(keyPrefix + key)),
            "get " + key,
            Optional.empty());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        jedisPooled.set(keyPrefix + key, value, SetParams.setParams().px(ttl.toMillis()));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        String reply = jedisPooled.set(keyPrefix + key, value, SetParams.setParams().nx().px(ttl.toMillis()));
        return "OK".equals(reply);
    }

    @Override
    public void delete(String key) {
        jedisPooled.del(keyPrefix + key);
    }
}
