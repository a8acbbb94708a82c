package com.williamcallahan.media_library.repository;

import com.williamcallahan.media_library.util.JdbcUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Composable SQL predicate: a fragment with {@code ?} placeholders plus its bound arguments.
 *
 * <p>Search filters translate each of their optional dimensions into one condition and AND them
 * together. A dimension without values becomes {@link #all()}, which matches every row and
 * disappears from the generated {@code WHERE} clause.</p>
 *
 * @param sql  fragment, empty for {@link #all()}
 * @param args arguments for the placeholders in {@code sql}, in order
 */
public record SqlCondition(String sql, List<Object> args) {

    private static final SqlCondition ALL = new SqlCondition("", List.of());

    public SqlCondition {
        sql = sql == null ? "" : sql;
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static SqlCondition all() {
        return ALL;
    }

    /**
     * {@code column IN (...)}, or {@link #all()} when {@code values} is null or empty.
     */
    public static SqlCondition in(String column, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            return ALL;
        }
        return new SqlCondition(column + " IN (" + JdbcUtils.placeholders(values.size()) + ")", List.copyOf(values));
    }

    /**
     * {@code column = ?}. A {@code null} value is rejected: callers looking up by a parent id
     * must decide what a missing id means before building the condition.
     *
     * @throws NullPointerException when {@code value} is null
     */
    public static SqlCondition equalTo(String column, Object value) {
        Objects.requireNonNull(value, () -> "value for " + column);
        return new SqlCondition(column + " = ?", List.of(value));
    }

    /**
     * {@code column >= ?}, or {@link #all()} when {@code value} is null (an unset optional bound).
     */
    public static SqlCondition greaterOrEqual(String column, Object value) {
        if (value == null) {
            return ALL;
        }
        return new SqlCondition(column + " >= ?", List.of(value));
    }

    public boolean matchesAll() {
        return sql.isEmpty();
    }

    public SqlCondition and(SqlCondition other) {
        if (other == null || other.matchesAll()) {
            return this;
        }
        if (matchesAll()) {
            return other;
        }
        List<Object> combined = new ArrayList<>(args);
        combined.addAll(other.args);
        return new SqlCondition("(" + sql + ") AND (" + other.sql + ")", combined);
    }

    /**
     * {@code " WHERE ..."} with a leading space, or the empty string when nothing is filtered.
     */
    public String toWhereClause() {
        return matchesAll() ? "" : " WHERE " + sql;
    }

    public Object[] argsArray() {
        return args.toArray();
    }
}
