package io.governor.jdbc;

import io.governor.StoreUnavailableException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the governor stores.
 */
public final class GovernorStoreException extends StoreUnavailableException {
    private static final String UNIQUE_VIOLATION = "23505";

    public GovernorStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the failure was a unique-key violation (SQLSTATE {@code 23505}). */
    public boolean isUniqueViolation() {
        return getCause() instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState());
    }
}
