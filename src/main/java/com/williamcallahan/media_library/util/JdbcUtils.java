package com.williamcallahan.media_library.util;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shared JDBC helpers so repositories don't repeat the same row-reading and
 * placeholder boilerplate.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for a single row with a RowMapper; empty when no row matches.
     */
    public static <T> Optional<T> queryForOptionalObject(JdbcTemplate jdbc, String sql, RowMapper<T> rowMapper, Object... params) {
        List<T> results = jdbc.query(sql, rowMapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Count query that never yields {@code null}.
     */
    public static long queryForCount(JdbcTemplate jdbc, String sql, Object... params) {
        Long count = jdbc.queryForObject(sql, Long.class, params);
        return count != null ? count : 0L;
    }

    /**
     * Check whether the count query returns a positive value.
     */
    public static boolean exists(JdbcTemplate jdbc, String sql, Object... params) {
        return queryForCount(jdbc, sql, params) > 0;
    }

    /**
     * Comma separated {@code ?} placeholders, one per value: {@code "?, ?, ?"}.
     */
    public static String placeholders(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    /**
     * Splits {@code values} into consecutive views of at most {@code size} elements, so that
     * {@code IN (...)} lists stay under the driver's bind-parameter limit.
     */
    public static <T> List<List<T>> partition(List<T> values, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int from = 0; from < values.size(); from += size) {
            chunks.add(values.subList(from, Math.min(from + size, values.size())));
        }
        return chunks;
    }

    public static String columnList(Collection<String> columns) {
        return String.join(", ", columns);
    }

    public static String assignmentList(Collection<String> columns) {
        return columns.stream().map(column -> column + " = ?").collect(Collectors.joining(", "));
    }

    /**
     * Nullable LocalDateTime from the ResultSet.
     */
    public static LocalDateTime getLocalDateTimeOrNull(ResultSet rs, String columnName) throws SQLException {
        return rs.getObject(columnName, LocalDateTime.class);
    }

    /**
     * Nullable LocalDate from the ResultSet.
     */
    public static LocalDate getLocalDateOrNull(ResultSet rs, String columnName) throws SQLException {
        return rs.getObject(columnName, LocalDate.class);
    }
}
