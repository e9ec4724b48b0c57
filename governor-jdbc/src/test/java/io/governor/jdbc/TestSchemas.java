package io.governor.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Creates databases from the bundled schema scripts.
 */
public final class TestSchemas {

    private TestSchemas() {}

    /** A fresh in-memory H2 database with the governor tables. */
    public static JdbcDataSource h2() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        apply(dataSource, "/schema/h2.sql");
        return dataSource;
    }

    public static void apply(DataSource dataSource, String resource) throws SQLException {
        String script = load(resource);
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : script.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty()) {
                    stmt.execute(trimmed);
                }
            }
        }
    }

    public static void insertCatalog(DataSource dataSource, String id, String name) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.update(conn,
                    "INSERT INTO catalog (id, name, attribute_hint, enrichment_status) VALUES (?,?,?,?)",
                    id, name, "brewer-" + id, "pending");
        }
    }

    private static String load(String resource) {
        try (InputStream is = TestSchemas.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Resource not found: " + resource);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
    }
}
