package io.governor.jdbc.ledger;

import io.governor.jdbc.GovernorStoreException;
import io.governor.jdbc.JdbcTemplate;
import io.governor.jdbc.TableNames;
import io.governor.model.Reservation;
import io.governor.spi.BudgetLedger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Base JDBC budget ledger.
 *
 * <p>The default {@link #reserve} is portable SQL: a conditional
 * {@code UPDATE ... WHERE request_count < ?} decides the reservation by its
 * rows-affected count. Only when the day has no row yet does it fall back to an
 * {@code INSERT}; losing that insert race to a concurrent caller re-runs the
 * conditional update. Subclasses with an upsert override {@link #reserve} with a
 * single statement.
 *
 * @see H2BudgetLedger
 * @see PostgresBudgetLedger
 */
public abstract class AbstractJdbcBudgetLedger implements BudgetLedger {

    private final String tableName;

    protected AbstractJdbcBudgetLedger() {
        this(TableNames.BUDGET_LEDGER);
    }

    protected AbstractJdbcBudgetLedger(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    protected String tableName() {
        return tableName;
    }

    @Override
    public Reservation reserve(Connection conn, String periodKey, int dailyLimit, Instant now) {
        if (dailyLimit <= 0) {
            return Reservation.denied(usedOn(conn, periodKey));
        }
        Timestamp ts = Timestamp.from(now);
        if (incrementBelowLimit(conn, periodKey, dailyLimit, ts)) {
            return Reservation.granted(usedOn(conn, periodKey));
        }
        List<Integer> existing = JdbcTemplate.query(conn,
                "SELECT request_count FROM " + tableName() + " WHERE period_key=?",
                rs -> rs.getInt(1), periodKey);
        if (!existing.isEmpty()) {
            return Reservation.denied(existing.get(0));
        }
        try {
            JdbcTemplate.update(conn,
                    "INSERT INTO " + tableName() + " (period_key, request_count, last_updated) VALUES (?,1,?)",
                    periodKey, ts);
            return Reservation.granted(1);
        } catch (GovernorStoreException e) {
            if (!e.isUniqueViolation()) {
                throw e;
            }
        }
        // Another caller created the row first
        if (incrementBelowLimit(conn, periodKey, dailyLimit, ts)) {
            return Reservation.granted(usedOn(conn, periodKey));
        }
        return Reservation.denied(usedOn(conn, periodKey));
    }

    private boolean incrementBelowLimit(Connection conn, String periodKey, int dailyLimit, Timestamp ts) {
        String sql = "UPDATE " + tableName() +
                " SET request_count=request_count+1, last_updated=?" +
                " WHERE period_key=? AND request_count<?";
        return JdbcTemplate.update(conn, sql, ts, periodKey, dailyLimit) == 1;
    }

    @Override
    public int usedOn(Connection conn, String periodKey) {
        return JdbcTemplate.queryForInt(conn,
                "SELECT request_count FROM " + tableName() + " WHERE period_key=?", periodKey);
    }

    @Override
    public int usedBetween(Connection conn, String fromKey, String toKey) {
        return JdbcTemplate.queryForInt(conn,
                "SELECT COALESCE(SUM(request_count), 0) FROM " + tableName() +
                        " WHERE period_key >= ? AND period_key <= ?",
                fromKey, toKey);
    }

    @Override
    public int purgeBefore(Connection conn, String periodKey, int limit) {
        String sql = "DELETE FROM " + tableName() + " WHERE period_key IN (" +
                "SELECT period_key FROM " + tableName() +
                " WHERE period_key < ? ORDER BY period_key LIMIT ?)";
        return JdbcTemplate.update(conn, sql, periodKey, limit);
    }
}
