package io.governor.spi;

import io.governor.model.Reservation;

import java.sql.Connection;
import java.time.Instant;

/**
 * Durable per-day request counter that enforces the daily budget.
 *
 * <p>Period keys are UTC dates formatted {@code yyyy-MM-dd}, so lexical order is
 * chronological. All methods receive an explicit {@link Connection}; the caller
 * controls transaction boundaries. Implementations live in {@code governor-jdbc}.
 */
public interface BudgetLedger {

    /**
     * Atomically reserves one request against {@code periodKey}.
     *
     * <p>Creates the day's row with a count of one if absent, otherwise increments
     * the count only while it is strictly below {@code dailyLimit}. Whether the
     * increment happened is decided by the same statement that performs it, so
     * concurrent callers can never push the count past the limit. A limit of
     * zero or less never reserves.
     *
     * @param conn       the JDBC connection
     * @param periodKey  the day key
     * @param dailyLimit the day's budget
     * @param now        written to {@code last_updated}
     * @return the reservation outcome
     */
    Reservation reserve(Connection conn, String periodKey, int dailyLimit, Instant now);

    /**
     * @return the count recorded for {@code periodKey}, zero if no row exists
     */
    int usedOn(Connection conn, String periodKey);

    /**
     * Sums counts for keys in {@code [fromKey, toKey]}, both inclusive.
     */
    int usedBetween(Connection conn, String fromKey, String toKey);

    /**
     * Deletes up to {@code limit} rows whose key sorts before {@code periodKey}.
     *
     * @return rows deleted
     */
    int purgeBefore(Connection conn, String periodKey, int limit);
}
