/**
 * STOMP over WebSocket for pushing series.available updates to browsers
 *
 * @author William Callahan
 *
 * Features:
 * - In-memory broker on /topic with 10 second heartbeats so idle tabs notice dead sockets
 * - Endpoint path and allowed origins come from configuration
 * - SockJS fallback for clients behind proxies that strip upgrades
 */

package com.williamcallahan.series_sync_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private static final long[] BROKER_HEARTBEAT_MILLIS = {10_000, 10_000};

    @Value("${app.cors.allowed-origins:*}")
    private String allowedOrigins;

    @Value("${app.websocket.endpoint:/ws}")
    private String endpoint;

    @Override
    public void configureMessageBroker(@NonNull MessageBrokerRegistry config) {
        ThreadPoolTaskScheduler heartbeatScheduler = new ThreadPoolTaskScheduler();
        heartbeatScheduler.setPoolSize(1);
        heartbeatScheduler.setThreadNamePrefix("stomp-heartbeat-");
        heartbeatScheduler.initialize();

        config.enableSimpleBroker("/topic")
            .setHeartbeatValue(BROKER_HEARTBEAT_MILLIS)
            .setTaskScheduler(heartbeatScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(@NonNull StompEndpointRegistry registry) {
        registry.addEndpoint(endpoint)
            .setAllowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"))
            .withSockJS();
    }
}
