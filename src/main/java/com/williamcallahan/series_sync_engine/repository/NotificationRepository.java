package com.williamcallahan.series_sync_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.series_sync_engine.model.Notification;
import com.williamcallahan.series_sync_engine.types.NotificationType;
import com.williamcallahan.series_sync_engine.util.JdbcUtils;
import com.williamcallahan.series_sync_engine.util.UuidUtil;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Postgres access for in-app notifications.
 */
@Repository
public class NotificationRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public NotificationRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Users who already received a notification of this type for the series since the given time.
     */
    public Set<String> findRecentlyNotifiedUserIds(String seriesId, NotificationType type, Instant since) {
        return new HashSet<>(jdbcTemplate.queryForList("""
            SELECT DISTINCT user_id::text
              FROM notifications
             WHERE series_id = ?::uuid
               AND type = ?
               AND created_at >= ?
            """, String.class, seriesId, type.name(), JdbcUtils.toTimestamp(since)));
    }

    /**
     * @return number of rows inserted
     */
    public int insertAll(List<Notification> notifications) {
        if (notifications == null || notifications.isEmpty()) {
            return 0;
        }
        int[] counts = jdbcTemplate.batchUpdate("""
            INSERT INTO notifications (id, user_id, series_id, type, title, message, metadata, created_at)
            VALUES (?::uuid, ?::uuid, ?::uuid, ?, ?, ?, ?::jsonb, NOW())
            """, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(@NonNull PreparedStatement ps, int i) throws SQLException {
                Notification notification = notifications.get(i);
                ps.setString(1, UuidUtil.newId());
                ps.setString(2, notification.userId());
                ps.setString(3, notification.seriesId());
                ps.setString(4, notification.type().name());
                ps.setString(5, notification.title());
                ps.setString(6, notification.message());
                ps.setString(7, toJson(notification));
            }

            @Override
            public int getBatchSize() {
                return notifications.size();
            }
        });
        int inserted = 0;
        for (int count : counts) {
            if (count > 0) {
                inserted += count;
            }
        }
        return inserted;
    }

    private String toJson(Notification notification) throws SQLException {
        try {
            return objectMapper.writeValueAsString(notification.metadata());
        } catch (JsonProcessingException e) {
            throw new SQLException("Unable to serialize notification metadata", e);
        }
    }
}
