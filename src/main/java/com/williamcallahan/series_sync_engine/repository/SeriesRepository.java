package com.williamcallahan.series_sync_engine.repository;

import com.williamcallahan.series_sync_engine.model.Series;
import com.williamcallahan.series_sync_engine.util.JdbcUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Postgres access for canonical series rows.
 */
@Repository
public class SeriesRepository {

    private static final String SELECT_COLUMNS = """
        SELECT s.id, s.title, s.mangadex_id, s.alternative_titles, s.description, s.cover_url,
               s.type, s.status, s.genres, s.content_rating, s.created_at, s.updated_at
        FROM series s
        """;

    private static final RowMapper<Series> ROW_MAPPER = new SeriesRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public SeriesRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Series> findById(String id) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate, SELECT_COLUMNS + " WHERE s.id = ?::uuid", ROW_MAPPER, id);
    }

    public Optional<Series> findByExternalId(String externalId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            SELECT_COLUMNS + " WHERE s.mangadex_id = ?", ROW_MAPPER, externalId);
    }

    /**
     * Series already linked to the given source entry.
     */
    public Optional<Series> findBySourceLink(String sourceName, String sourceId) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            SELECT_COLUMNS + """
                 JOIN series_sources ss ON ss.series_id = s.id
                 WHERE ss.source_name = ? AND ss.source_id = ?
                """,
            ROW_MAPPER, sourceName, sourceId);
    }

    /**
     * Case-insensitive exact title match; the oldest series wins when several share a title.
     */
    public Optional<Series> findByTitleIgnoreCase(String title) {
        return JdbcUtils.queryForOptionalObject(jdbcTemplate,
            SELECT_COLUMNS + " WHERE LOWER(s.title) = LOWER(?) ORDER BY s.created_at ASC LIMIT 1",
            ROW_MAPPER, title);
    }

    public void insert(Series series) {
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO series (id, title, mangadex_id, alternative_titles, description, cover_url,
                                    type, status, genres, content_rating, created_at, updated_at)
                VALUES (?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW())
                """);
            ps.setString(1, series.getId());
            ps.setString(2, series.getTitle());
            ps.setString(3, series.getExternalId());
            ps.setArray(4, textArray(connection, series.getAlternativeTitles()));
            ps.setString(5, series.getDescription());
            ps.setString(6, series.getCoverUrl());
            ps.setString(7, series.getType());
            ps.setString(8, series.getStatus());
            ps.setArray(9, textArray(connection, series.getGenres()));
            ps.setString(10, series.getContentRating());
            return ps;
        });
    }

    public void update(Series series) {
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                UPDATE series
                   SET mangadex_id = ?, alternative_titles = ?, description = ?, cover_url = ?,
                       type = ?, status = ?, genres = ?, content_rating = ?, updated_at = NOW()
                 WHERE id = ?::uuid
                """);
            ps.setString(1, series.getExternalId());
            ps.setArray(2, textArray(connection, series.getAlternativeTitles()));
            ps.setString(3, series.getDescription());
            ps.setString(4, series.getCoverUrl());
            ps.setString(5, series.getType());
            ps.setString(6, series.getStatus());
            ps.setArray(7, textArray(connection, series.getGenres()));
            ps.setString(8, series.getContentRating());
            ps.setString(9, series.getId());
            return ps;
        });
    }

    private static java.sql.Array textArray(Connection connection, List<String> values) throws SQLException {
        return connection.createArrayOf("text", values == null ? new String[0] : values.toArray(new String[0]));
    }

    private static class SeriesRowMapper implements RowMapper<Series> {
        @Override
        public Series mapRow(@NonNull ResultSet rs, int rowNum) throws SQLException {
            return Series.builder()
                .id(rs.getString("id"))
                .title(rs.getString("title"))
                .externalId(rs.getString("mangadex_id"))
                .alternativeTitles(JdbcUtils.getStringList(rs, "alternative_titles"))
                .description(rs.getString("description"))
                .coverUrl(rs.getString("cover_url"))
                .type(rs.getString("type"))
                .status(rs.getString("status"))
                .genres(JdbcUtils.getStringList(rs, "genres"))
                .contentRating(rs.getString("content_rating"))
                .createdAt(JdbcUtils.getInstant(rs, "created_at"))
                .updatedAt(JdbcUtils.getInstant(rs, "updated_at"))
                .build();
        }
    }
}
