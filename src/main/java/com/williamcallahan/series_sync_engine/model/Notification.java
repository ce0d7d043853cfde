package com.williamcallahan.series_sync_engine.model;

import com.williamcallahan.series_sync_engine.types.NotificationType;

import java.util.Map;

/**
 * In-app notification row for a single user.
 */
public record Notification(
    String userId,
    String seriesId,
    NotificationType type,
    String title,
    String message,
    Map<String, Object> metadata
) {
}
