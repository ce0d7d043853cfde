package com.williamcallahan.series_sync_engine.repository;

import com.williamcallahan.series_sync_engine.model.Chapter;
import com.williamcallahan.series_sync_engine.util.JdbcUtils;
import com.williamcallahan.series_sync_engine.util.UuidUtil;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Postgres access for per-source chapters.
 */
@Repository
public class ChapterRepository {

    private final JdbcTemplate jdbcTemplate;

    public ChapterRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Chapter numbers already stored for a source link.
     */
    public Set<BigDecimal> findChapterNumbers(String seriesSourceId) {
        List<BigDecimal> numbers = jdbcTemplate.queryForList(
            "SELECT chapter_number FROM chapters WHERE series_source_id = ?::uuid",
            BigDecimal.class, seriesSourceId);
        return new HashSet<>(numbers);
    }

    /**
     * Inserts chapters, silently skipping any (link, number) pair that already exists.
     *
     * @return number of rows actually inserted
     */
    public int insertIgnoringDuplicates(List<Chapter> chapters) {
        if (chapters == null || chapters.isEmpty()) {
            return 0;
        }
        int[] counts = jdbcTemplate.batchUpdate("""
            INSERT INTO chapters (id, series_id, series_source_id, chapter_number, chapter_title,
                                  chapter_url, published_at, discovered_at)
            VALUES (?::uuid, ?::uuid, ?::uuid, ?, ?, ?, ?, NOW())
            ON CONFLICT (series_source_id, chapter_number) DO NOTHING
            """, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(@NonNull PreparedStatement ps, int i) throws SQLException {
                Chapter chapter = chapters.get(i);
                ps.setString(1, UuidUtil.newId());
                ps.setString(2, chapter.seriesId());
                ps.setString(3, chapter.seriesSourceId());
                ps.setBigDecimal(4, chapter.chapterNumber());
                ps.setString(5, chapter.title());
                ps.setString(6, chapter.url());
                ps.setTimestamp(7, JdbcUtils.toTimestamp(chapter.publishedAt()));
            }

            @Override
            public int getBatchSize() {
                return chapters.size();
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
}
