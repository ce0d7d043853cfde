package com.williamcallahan.series_sync_engine.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read access to user library entries.
 */
@Repository
public class LibraryEntryRepository {

    private final JdbcTemplate jdbcTemplate;

    public LibraryEntryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Users following the series who opted into new-chapter alerts.
     */
    public List<String> findSubscriberIds(String seriesId) {
        return jdbcTemplate.queryForList("""
            SELECT DISTINCT user_id::text
              FROM library_entries
             WHERE series_id = ?::uuid
               AND notify_new_chapters = TRUE
            """, String.class, seriesId);
    }
}
