package io.governor.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to the governor's facades. Every breaker check,
 * consumer batch, admin call and cleanup batch borrows its own connection.
 *
 * <p>Callers close the returned connection.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * @return an open connection; the caller must close it
     * @throws SQLException if no connection can be obtained
     */
    Connection getConnection() throws SQLException;
}
