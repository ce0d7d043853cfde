package com.williamcallahan.series_sync_engine.repository;

import com.williamcallahan.series_sync_engine.model.SeriesSource;
import com.williamcallahan.series_sync_engine.types.SyncPriority;
import com.williamcallahan.series_sync_engine.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Postgres access for source links: scheduling, sync bookkeeping and canonical upserts.
 */
@Repository
public class SeriesSourceRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, series_id, source_name, source_id, source_url, source_title, match_confidence,
               cover_url, cover_width, cover_height, cover_updated_at, is_primary_cover, sync_priority, next_check_at, last_checked_at,
               last_success_at, failure_count, chapter_count
        FROM series_sources
        """;

    private static final RowMapper<SeriesSource> ROW_MAPPER = new SeriesSourceRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public SeriesSourceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<SeriesSource> findById(String id) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            SELECT_COLUMNS + " WHERE id = ?::uuid", ROW_MAPPER, id);
    }

    public Optional<SeriesSource> findBySourceKey(String sourceName, String sourceId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            SELECT_COLUMNS + " WHERE source_name = ? AND source_id = ?", ROW_MAPPER, sourceName, sourceId);
    }

    /**
     * Links whose next check is due (or was never scheduled), oldest first.
     */
    public List<SeriesSource> findDueForSync(Instant now, int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + """
                 WHERE next_check_at IS NULL OR next_check_at <= ?
                 ORDER BY next_check_at ASC NULLS FIRST
                 LIMIT ?
                """,
            ROW_MAPPER, JdbcUtils.toTimestamp(now), limit);
    }

    /**
     * Stamps the next check time on a batch of links in one statement.
     */
    public int scheduleNextCheck(Collection<String> ids, Instant nextCheckAt) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        UUID[] idsArray = ids.stream().map(UUID::fromString).toArray(UUID[]::new);
        return jdbcTemplate.update(
            "UPDATE series_sources SET next_check_at = ?, updated_at = NOW() WHERE id = ANY(?::uuid[])",
            JdbcUtils.toTimestamp(nextCheckAt), idsArray);
    }

    /**
     * Parks a link whose circuit is open: COLD tier, next check pushed out.
     */
    public void openCircuit(String id, Instant nextCheckAt) {
        jdbcTemplate.update("""
            UPDATE series_sources
               SET sync_priority = ?, next_check_at = ?, updated_at = NOW()
             WHERE id = ?::uuid
            """, SyncPriority.COLD.name(), JdbcUtils.toTimestamp(nextCheckAt), id);
    }

    public void recordFailure(String id, Instant checkedAt) {
        jdbcTemplate.update("""
            UPDATE series_sources
               SET failure_count = failure_count + 1, last_checked_at = ?, updated_at = NOW()
             WHERE id = ?::uuid
            """, JdbcUtils.toTimestamp(checkedAt), id);
    }

    public void recordSuccess(String id, Instant checkedAt, int insertedChapters) {
        jdbcTemplate.update("""
            UPDATE series_sources
               SET failure_count = 0, last_checked_at = ?, last_success_at = ?,
                   chapter_count = chapter_count + ?, updated_at = NOW()
             WHERE id = ?::uuid
            """, JdbcUtils.toTimestamp(checkedAt), JdbcUtils.toTimestamp(checkedAt), insertedChapters, id);
    }

    /**
     * Creates or re-points the link for (sourceName, sourceId). New links start COLD.
     * An existing cover is kept when the incoming one is null.
     */
    public void upsertLink(SourceLinkUpsert link) {
        jdbcTemplate.update("""
            INSERT INTO series_sources (id, series_id, source_name, source_id, source_url, source_title,
                                        match_confidence, cover_url, cover_width, cover_height,
                                        cover_updated_at, is_primary_cover, sync_priority,
                                        failure_count, chapter_count, created_at, updated_at)
            VALUES (?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, 0, NOW(), NOW())
            ON CONFLICT (source_name, source_id) DO UPDATE SET
                series_id = EXCLUDED.series_id,
                source_url = EXCLUDED.source_url,
                source_title = EXCLUDED.source_title,
                match_confidence = EXCLUDED.match_confidence,
                cover_url = COALESCE(EXCLUDED.cover_url, series_sources.cover_url),
                cover_width = CASE WHEN EXCLUDED.cover_url IS NOT NULL
                                   THEN EXCLUDED.cover_width ELSE series_sources.cover_width END,
                cover_height = CASE WHEN EXCLUDED.cover_url IS NOT NULL
                                    THEN EXCLUDED.cover_height ELSE series_sources.cover_height END,
                cover_updated_at = CASE WHEN EXCLUDED.cover_url IS NOT NULL
                                        THEN EXCLUDED.cover_updated_at
                                        ELSE series_sources.cover_updated_at END,
                is_primary_cover = CASE WHEN EXCLUDED.cover_url IS NOT NULL
                                        THEN EXCLUDED.is_primary_cover
                                        ELSE series_sources.is_primary_cover END,
                updated_at = NOW()
            """,
            link.id(), link.seriesId(), link.sourceName(), link.sourceId(), link.sourceUrl(), link.sourceTitle(),
            link.matchConfidence(), link.coverUrl(), link.coverWidth(), link.coverHeight(),
            link.coverUrl() != null ? JdbcUtils.toTimestamp(link.updatedAt()) : null,
            link.coverUrl() != null && link.primaryCover(),
            SyncPriority.COLD.name());
    }

    /**
     * Drops the primary-cover flag from every other link of the series.
     */
    public int clearPrimaryCover(String seriesId, String keepSourceName, String keepSourceId) {
        return jdbcTemplate.update("""
            UPDATE series_sources
               SET is_primary_cover = FALSE, updated_at = NOW()
             WHERE series_id = ?::uuid
               AND is_primary_cover
               AND NOT (source_name = ? AND source_id = ?)
            """, seriesId, keepSourceName, keepSourceId);
    }

    /**
     * Values written by {@link #upsertLink(SourceLinkUpsert)}.
     *
     * @param id id used only when the link is created
     * @param primaryCover the link's cover is the one shown on the series
     */
    public record SourceLinkUpsert(
        String id,
        String seriesId,
        String sourceName,
        String sourceId,
        String sourceUrl,
        String sourceTitle,
        BigDecimal matchConfidence,
        String coverUrl,
        Integer coverWidth,
        Integer coverHeight,
        boolean primaryCover,
        Instant updatedAt
    ) {
    }

    private static class SeriesSourceRowMapper implements RowMapper<SeriesSource> {
        @Override
        public SeriesSource mapRow(@NonNull ResultSet rs, int rowNum) throws SQLException {
            return SeriesSource.builder()
                .id(rs.getString("id"))
                .seriesId(rs.getString("series_id"))
                .sourceName(rs.getString("source_name"))
                .sourceId(rs.getString("source_id"))
                .sourceUrl(rs.getString("source_url"))
                .sourceTitle(rs.getString("source_title"))
                .matchConfidence(rs.getBigDecimal("match_confidence"))
                .coverUrl(rs.getString("cover_url"))
                .coverWidth(rs.getObject("cover_width", Integer.class))
                .coverHeight(rs.getObject("cover_height", Integer.class))
                .coverUpdatedAt(JdbcUtils.getInstant(rs, "cover_updated_at"))
                .primaryCover(rs.getBoolean("is_primary_cover"))
                .syncPriority(SyncPriority.fromValue(rs.getString("sync_priority")))
                .nextCheckAt(JdbcUtils.getInstant(rs, "next_check_at"))
                .lastCheckedAt(JdbcUtils.getInstant(rs, "last_checked_at"))
                .lastSuccessAt(JdbcUtils.getInstant(rs, "last_success_at"))
                .failureCount(rs.getInt("failure_count"))
                .chapterCount(rs.getInt("chapter_count"))
                .build();
        }
    }
}
