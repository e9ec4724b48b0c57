package io.governor.jdbc.dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link JdbcDialect}s with auto-detection from a JDBC URL.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcDialect dialect = JdbcDialects.detect(dataSource);
 * BudgetLedger ledger = dialect.budgetLedger();
 *
 * JdbcDialect pg = JdbcDialects.get("postgresql");
 * }</pre>
 */
public final class JdbcDialects {

    private static final List<JdbcDialect> DIALECTS;
    private static final Map<String, JdbcDialect> BY_NAME = new ConcurrentHashMap<>();

    static {
        DIALECTS = ServiceLoader.load(JdbcDialect.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (JdbcDialect dialect : DIALECTS) {
            BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
        }
    }

    private JdbcDialects() {
    }

    public static List<JdbcDialect> all() {
        return DIALECTS;
    }

    /**
     * Gets a dialect by name.
     *
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static JdbcDialect get(String name) {
        Objects.requireNonNull(name, "name");
        JdbcDialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown dialect: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return dialect;
    }

    /**
     * Detects the dialect from a DataSource's connection metadata.
     *
     * @throws IllegalStateException if the URL cannot be read or matches no dialect
     */
    public static JdbcDialect detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            return detect(conn.getMetaData().getURL());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect dialect from DataSource", e);
        }
    }

    /**
     * Detects the dialect from a JDBC URL.
     *
     * @throws IllegalArgumentException if no dialect matches
     */
    public static JdbcDialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (JdbcDialect dialect : DIALECTS) {
            for (String prefix : dialect.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return dialect;
                }
            }
        }
        throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + DIALECTS.stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList());
    }
}
