package com.williamcallahan.series_sync_engine.util;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC helpers so repositories don't repeat null handling for
 * single-row lookups, timestamps and Postgres text arrays.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for a single object with a RowMapper, returning Optional.
     */
    public static <T> Optional<T> queryForOptionalObject(JdbcTemplate jdbc, String sql, RowMapper<T> rowMapper, Object... params) {
        List<T> results = jdbc.query(sql, rowMapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Null-safe conversion for timestamp parameters.
     */
    public static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    /**
     * Null-safe read of a timestamp column.
     */
    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    /**
     * Reads a {@code text[]} column. SQL NULL and NULL elements are dropped.
     */
    public static List<String> getStringList(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        if (array.getArray() instanceof String[] raw) {
            for (String value : raw) {
                if (value != null) {
                    values.add(value);
                }
            }
        }
        return values;
    }
}
