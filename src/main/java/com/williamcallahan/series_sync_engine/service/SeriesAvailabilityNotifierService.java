/**
 * Service for real-time broadcast of newly available series
 *
 * @author William Callahan
 *
 * Features:
 * - Forwards SeriesAvailableEvent to STOMP subscribers on a single topic
 * - Uses lazy initialization to prevent circular dependency issues
 * - Broker failures are logged and never reach the publisher
 */
package com.williamcallahan.series_sync_engine.service;

import com.williamcallahan.series_sync_engine.service.event.SeriesAvailableEvent;
import com.williamcallahan.series_sync_engine.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.core.MessageSendingOperations;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
@Lazy
public class SeriesAvailabilityNotifierService {

    private static final Logger logger = LoggerFactory.getLogger(SeriesAvailabilityNotifierService.class);

    static final String DESTINATION = "/topic/series.available";

    private final MessageSendingOperations<String> messagingTemplate;

    /**
     * @param messagingTemplate Template for sending WebSocket messages, lazy-loaded
     */
    public SeriesAvailabilityNotifierService(@Lazy MessageSendingOperations<String> messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * Broadcasts a series.available message for the event.
     *
     * @param event the canonicalized series
     */
    @EventListener
    public void handleSeriesAvailable(SeriesAvailableEvent event) {
        if (event.getSeriesId() == null) {
            logger.warn("Received SeriesAvailableEvent without series id, title '{}'", event.getTitle());
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("series_id", event.getSeriesId());
        payload.put("external_id", event.getExternalId());
        payload.put("title", event.getTitle());
        payload.put("created", event.isCreated());

        try {
            messagingTemplate.convertAndSend(DESTINATION, payload);
            logger.debug("Broadcast series.available for {} ('{}')", event.getSeriesId(), event.getTitle());
        } catch (MessagingException e) {
            LoggingUtils.warn(logger, e, "Failed to broadcast series.available for {}", event.getSeriesId());
        }
    }
}
