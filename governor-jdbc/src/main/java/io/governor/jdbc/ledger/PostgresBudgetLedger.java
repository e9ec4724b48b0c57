package io.governor.jdbc.ledger;

import io.governor.jdbc.JdbcTemplate;
import io.governor.model.Reservation;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL budget ledger.
 *
 * <p>Reserves with one {@code INSERT ... ON CONFLICT DO UPDATE ... WHERE
 * request_count < ? RETURNING request_count}: a returned row means the increment
 * (or the first insert of the day) happened.
 */
public final class PostgresBudgetLedger extends AbstractJdbcBudgetLedger {

    public PostgresBudgetLedger() {
        super();
    }

    public PostgresBudgetLedger(String tableName) {
        super(tableName);
    }

    @Override
    public Reservation reserve(Connection conn, String periodKey, int dailyLimit, Instant now) {
        if (dailyLimit <= 0) {
            return Reservation.denied(usedOn(conn, periodKey));
        }
        String sql = "INSERT INTO " + tableName() + " AS l (period_key, request_count, last_updated)" +
                " VALUES (?, 1, ?)" +
                " ON CONFLICT (period_key) DO UPDATE" +
                " SET request_count = l.request_count + 1, last_updated = EXCLUDED.last_updated" +
                " WHERE l.request_count < ?" +
                " RETURNING request_count";
        List<Integer> counts = JdbcTemplate.updateReturning(conn, sql, rs -> rs.getInt(1),
                periodKey, Timestamp.from(now), dailyLimit);
        if (counts.isEmpty()) {
            return Reservation.denied(usedOn(conn, periodKey));
        }
        return Reservation.granted(counts.get(0));
    }
}
