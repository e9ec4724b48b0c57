package io.governor.jdbc;

import io.governor.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>Connections are handed out in autocommit mode. Each store call is then its
 * own transaction, so a granted reservation or a replay claim is visible to other
 * workers as soon as the call returns.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
    private final DataSource dataSource;

    public DataSourceConnectionProvider(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Connection getConnection() throws SQLException {
        Connection conn = dataSource.getConnection();
        try {
            if (!conn.getAutoCommit()) {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public DataSource dataSource() {
        return dataSource;
    }
}
