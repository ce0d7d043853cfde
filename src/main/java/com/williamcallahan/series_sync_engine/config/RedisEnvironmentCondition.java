/**
 * Condition enabling the Redis-backed queue and coordination store
 *
 * @author William Callahan
 *
 * Features:
 * - Matches when REDIS_SERVER or any spring.redis connection property is set
 * - {@link Absent} is the inverse, selecting the in-memory fallbacks
 * - Logs the detected mode once per JVM
 */
package com.williamcallahan.series_sync_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;

public class RedisEnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(RedisEnvironmentCondition.class);
    private static volatile boolean hasLoggedMode = false;

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        boolean configured = isRedisConfigured(context.getEnvironment());
        if (!hasLoggedMode) {
            hasLoggedMode = true;
            if (configured) {
                logger.info("Redis configuration detected - pipeline queue and coordination keys use Redis");
            } else {
                logger.info("No Redis configuration - pipeline runs on the in-memory queue and store");
            }
        }
        return configured;
    }

    static boolean isRedisConfigured(Environment env) {
        return hasText(env.getProperty("REDIS_SERVER"))
            || hasText(env.getProperty("spring.redis.host"))
            || hasText(env.getProperty("spring.redis.port"));
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    /**
     * Matches when no Redis connection is configured.
     */
    public static class Absent implements Condition {
        @Override
        public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
            return !isRedisConfigured(context.getEnvironment());
        }
    }
}
