/**
 * Redis configuration for the sync pipeline using Jedis directly
 *
 * @author William Callahan
 *
 * Features:
 * - Builds a pooled Jedis client from REDIS_SERVER or discrete spring.redis properties
 * - TLS for rediss:// URLs or when spring.redis.ssl is set
 * - Exposes the Redis-backed job queue and coordination store
 * - Fails startup when Redis is configured but unreachable
 */

package com.williamcallahan.series_sync_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.queue.JobQueue;
import com.williamcallahan.series_sync_engine.queue.RedisJobQueue;
import com.williamcallahan.series_sync_engine.service.cache.CoordinationStore;
import com.williamcallahan.series_sync_engine.service.cache.RedisCoordinationStore;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.Connection;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;

@Configuration
@Conditional(RedisEnvironmentCondition.class)
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);
    private static final int DEFAULT_PORT = 6379;

    @Value("${REDIS_SERVER:#{null}}")
    private String redisUrl;

    @Value("${spring.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.redis.port:6379}")
    private int redisPort;

    @Value("${spring.redis.password:#{null}}")
    private String redisPassword;

    @Value("${spring.redis.ssl:false}")
    private boolean useSsl;

    @Value("${spring.redis.timeout:10000}")
    private int timeoutMillis;

    @Value("${spring.redis.jedis.pool.max-active:32}")
    private int maxActive;

    @Value("${spring.redis.jedis.pool.max-idle:8}")
    private int maxIdle;

    @Value("${spring.redis.jedis.pool.min-idle:2}")
    private int minIdle;

    @Value("${spring.redis.jedis.pool.max-wait:5000}")
    private int maxWaitMillis;

    /**
     * Pooled client shared by the queue and the coordination store.
     * Closed by {@link GracefulShutdownConfig} after workers drain.
     */
    @Bean(destroyMethod = "")
    public JedisPooled jedisPooled() {
        URI uri = parseRedisUrl();
        HostAndPort hostAndPort = uri != null
            ? new HostAndPort(uri.getHost(), uri.getPort() != -1 ? uri.getPort() : DEFAULT_PORT)
            : new HostAndPort(redisHost, redisPort);

        DefaultJedisClientConfig.Builder clientConfig = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeoutMillis)
            .socketTimeoutMillis(timeoutMillis)
            .ssl(useSsl || (uri != null && "rediss".equalsIgnoreCase(uri.getScheme())));
        String password = passwordFrom(uri);
        if (password != null && !password.isEmpty()) {
            clientConfig.password(password);
        }

        GenericObjectPoolConfig<Connection> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(maxWaitMillis));
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofSeconds(60));
        poolConfig.setMinEvictableIdleDuration(Duration.ofSeconds(120));

        logger.info("Creating JedisPooled: host={}, port={}, pool(maxTotal={}, maxIdle={}, minIdle={}), passwordProvided={}",
            hostAndPort.getHost(), hostAndPort.getPort(), maxActive, maxIdle, minIdle, password != null);

        JedisPooled jedis = new JedisPooled(hostAndPort, clientConfig.build(), poolConfig);
        try {
            logger.info("Redis ping on startup: {}", jedis.ping());
        } catch (Exception e) {
            jedis.close();
            throw new IllegalStateException("Failed to ping Redis during startup: " + e.getMessage(), e);
        }
        return jedis;
    }

    @Bean
    public JobQueue jobQueue(JedisPooled jedisPooled, ObjectMapper objectMapper, Clock clock, PipelineProperties properties) {
        return new RedisJobQueue(jedisPooled, objectMapper, clock, properties.getKeyPrefix());
    }

    @Bean
    public CoordinationStore coordinationStore(JedisPooled jedisPooled, PipelineProperties properties) {
        return new RedisCoordinationStore(jedisPooled, properties.getKeyPrefix());
    }

    private URI parseRedisUrl() {
        if (redisUrl == null || redisUrl.isBlank()) {
            return null;
        }
        try {
            return new URI(redisUrl);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid REDIS_SERVER URL: " + maskCredentials(redisUrl), e);
        }
    }

    private String passwordFrom(URI uri) {
        if (uri != null && uri.getUserInfo() != null) {
            String[] userInfo = uri.getUserInfo().split(":", 2);
            if (userInfo.length > 1) {
                return userInfo[1];
            }
        }
        return redisPassword;
    }

    static String maskCredentials(String url) {
        int at = url.lastIndexOf('@');
        int scheme = url.indexOf("://");
        if (at < 0 || scheme < 0 || at < scheme) {
            return url;
        }
        return url.substring(0, scheme + 3) + "******" + url.substring(at);
    }
}
