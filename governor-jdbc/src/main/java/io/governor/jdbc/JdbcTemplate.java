package io.governor.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Lightweight JDBC helper shared by the governor stores. Every
 * {@link SQLException} is rethrown as {@link GovernorStoreException}.
 */
public final class JdbcTemplate {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Execute INSERT/UPDATE/DELETE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new GovernorStoreException("Failed to execute update", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return mapAll(ps, mapper);
        } catch (SQLException e) {
            throw new GovernorStoreException("Failed to execute query", e);
        }
    }

    /** Execute a data-changing statement with {@code RETURNING}, map returned rows (PostgreSQL). */
    public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return mapAll(ps, mapper);
        } catch (SQLException e) {
            throw new GovernorStoreException("Failed to execute updateReturning", e);
        }
    }

    /** Execute a single-value SELECT; a missing row or SQL {@code NULL} yields zero. */
    public static int queryForInt(Connection conn, String sql, Object... params) {
        List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
        if (values.isEmpty()) {
            return 0;
        }
        return Math.toIntExact(values.get(0));
    }

    /** {@code ?,?,?} with {@code count} markers, for {@code IN (...)} lists. */
    public static String placeholders(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        StringJoiner joiner = new StringJoiner(",");
        for (int i = 0; i < count; i++) {
            joiner.add("?");
        }
        return joiner.toString();
    }

    private static <T> List<T> mapAll(PreparedStatement ps, RowMapper<T> mapper) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<T> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapper.map(rs));
            }
            return results;
        }
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Double d) {
                ps.setDouble(i + 1, d);
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private JdbcTemplate() {}
}
