package io.governor.jdbc.dead;

import io.governor.jdbc.GovernorStoreException;
import io.governor.jdbc.JdbcTemplate;
import io.governor.jdbc.TableNames;
import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterRecord;
import io.governor.model.DeadLetterStatus;
import io.governor.model.SourceCount;
import io.governor.spi.DeadLetterQuery;
import io.governor.spi.DeadLetterStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base JDBC dead-letter store with portable SQL.
 *
 * <p>Replay claims are two-phase: an {@code UPDATE} tags pending rows with the
 * caller's claim token, then a {@code SELECT} by token returns exactly the rows
 * this caller won. Subclasses may collapse both into one statement.
 *
 * <p>{@code failed_at} is stored at millisecond precision so that pagination
 * cursors compare exactly.
 *
 * @see H2DeadLetterStore
 * @see PostgresDeadLetterStore
 */
public abstract class AbstractJdbcDeadLetterStore implements DeadLetterStore {
    private static final int MAX_REASON_LENGTH = 4000;

    protected static final String COLUMNS =
            "id, message_id, record_id, name, brewer, failure_reason, failed_at, failure_count, " +
            "source_queue, status, replay_count, replayed_at, acknowledged_at";
    protected static final String COLUMNS_WITH_RAW = COLUMNS + ", raw_message";

    protected static final JdbcTemplate.RowMapper<DeadLetterEntry> ENTRY_MAPPER = rs -> mapEntry(rs, false);
    protected static final JdbcTemplate.RowMapper<DeadLetterEntry> ENTRY_WITH_RAW_MAPPER = rs -> mapEntry(rs, true);

    private final String tableName;

    protected AbstractJdbcDeadLetterStore() {
        this(TableNames.DEAD_LETTER);
    }

    protected AbstractJdbcDeadLetterStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    protected String tableName() {
        return tableName;
    }

    @Override
    public void ingest(Connection conn, DeadLetterRecord record, Instant failedAt) {
        Timestamp ts = Timestamp.from(failedAt.truncatedTo(ChronoUnit.MILLIS));
        if (resetExisting(conn, record, ts) > 0) {
            return;
        }
        String insertSql = "INSERT INTO " + tableName() + " (" +
                "message_id, record_id, name, brewer, failure_reason, failed_at, failure_count, " +
                "source_queue, status, replay_count, raw_message" +
                ") VALUES (?,?,?,?,?,?,?,?,?,0,?)";
        try {
            JdbcTemplate.update(conn, insertSql,
                    record.messageId(), record.recordId(), record.name(), record.brewer(),
                    truncateReason(record.failureReason()), ts, record.failureCount(),
                    record.sourceQueue(), DeadLetterStatus.PENDING.code(), record.rawMessage());
        } catch (GovernorStoreException e) {
            if (!e.isUniqueViolation()) {
                throw e;
            }
            resetExisting(conn, record, ts);
        }
    }

    private int resetExisting(Connection conn, DeadLetterRecord record, Timestamp failedAt) {
        String sql = "UPDATE " + tableName() +
                " SET record_id=?, name=?, brewer=?, failure_reason=?, failed_at=?, failure_count=?," +
                " source_queue=?, status=?, raw_message=?, claimed_by=NULL" +
                " WHERE message_id=?";
        return JdbcTemplate.update(conn, sql,
                record.recordId(), record.name(), record.brewer(), truncateReason(record.failureReason()),
                failedAt, record.failureCount(), record.sourceQueue(), DeadLetterStatus.PENDING.code(),
                record.rawMessage(), record.messageId());
    }

    @Override
    public List<DeadLetterEntry> list(Connection conn, DeadLetterQuery query) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(query.includeRaw() ? COLUMNS_WITH_RAW : COLUMNS)
                .append(" FROM ").append(tableName())
                .append(where(query.status(), query.recordId(), params));
        if (query.after() != null) {
            sql.append(params.isEmpty() ? " WHERE " : " AND ")
                    .append("(failed_at < ? OR (failed_at = ? AND id < ?))");
            Timestamp failedAt = Timestamp.from(query.after().failedAt());
            params.add(failedAt);
            params.add(failedAt);
            params.add(query.after().id());
        }
        sql.append(" ORDER BY failed_at DESC, id DESC LIMIT ?");
        params.add(query.limit());
        return JdbcTemplate.query(conn, sql.toString(),
                query.includeRaw() ? ENTRY_WITH_RAW_MAPPER : ENTRY_MAPPER, params.toArray());
    }

    @Override
    public int count(Connection conn, DeadLetterStatus status, String recordId) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM " + tableName() + where(status, recordId, params);
        return JdbcTemplate.queryForInt(conn, sql, params.toArray());
    }

    @Override
    public Optional<DeadLetterEntry> findById(Connection conn, long id) {
        return JdbcTemplate.query(conn,
                "SELECT " + COLUMNS_WITH_RAW + " FROM " + tableName() + " WHERE id=?",
                ENTRY_WITH_RAW_MAPPER, id).stream().findFirst();
    }

    @Override
    public Map<DeadLetterStatus, Integer> countByStatus(Connection conn) {
        Map<DeadLetterStatus, Integer> counts = new EnumMap<>(DeadLetterStatus.class);
        for (DeadLetterStatus status : DeadLetterStatus.values()) {
            counts.put(status, 0);
        }
        JdbcTemplate.query(conn,
                "SELECT status, COUNT(*) FROM " + tableName() + " GROUP BY status",
                rs -> {
                    String code = rs.getString(1);
                    int rows = Math.toIntExact(rs.getLong(2));
                    DeadLetterStatus.find(code).ifPresent(s -> counts.put(s, rows));
                    return code;
                });
        return counts;
    }

    @Override
    public Optional<Instant> oldestPendingFailedAt(Connection conn) {
        List<Optional<Instant>> rows = JdbcTemplate.query(conn,
                "SELECT MIN(failed_at) FROM " + tableName() + " WHERE status=?",
                rs -> Optional.ofNullable(toInstant(rs.getTimestamp(1))),
                DeadLetterStatus.PENDING.code());
        return rows.isEmpty() ? Optional.empty() : rows.get(0);
    }

    @Override
    public List<SourceCount> topFailingSources(Connection conn, int limit) {
        String sql = "SELECT brewer, COUNT(*) AS failures" +
                " FROM " + tableName() + " WHERE status=? AND brewer IS NOT NULL" +
                " GROUP BY brewer" +
                " ORDER BY failures DESC, brewer ASC LIMIT ?";
        return JdbcTemplate.query(conn, sql,
                rs -> new SourceCount(rs.getString(1), Math.toIntExact(rs.getLong(2))),
                DeadLetterStatus.PENDING.code(), limit);
    }

    @Override
    public List<DeadLetterEntry> repeatFailures(Connection conn, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE status=? AND replay_count > 0" +
                " ORDER BY replay_count DESC, failed_at DESC, id DESC LIMIT ?";
        return JdbcTemplate.query(conn, sql, ENTRY_MAPPER, DeadLetterStatus.PENDING.code(), limit);
    }

    @Override
    public int countEnteredSince(Connection conn, DeadLetterStatus status, Instant since) {
        String sql = "SELECT COUNT(*) FROM " + tableName() +
                " WHERE status=? AND " + transitionColumn(status) + " >= ?";
        return JdbcTemplate.queryForInt(conn, sql, status.code(), Timestamp.from(since));
    }

    @Override
    public int countFailedSince(Connection conn, Instant since) {
        return JdbcTemplate.queryForInt(conn,
                "SELECT COUNT(*) FROM " + tableName() + " WHERE failed_at >= ?", Timestamp.from(since));
    }

    @Override
    public List<DeadLetterEntry> claimForReplay(Connection conn, Collection<Long> ids, String claimToken, Instant now) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String claimSql = "UPDATE " + tableName() + " SET status=?, claimed_by=?" +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND status=?";
        int claimed = JdbcTemplate.update(conn, claimSql,
                params(DeadLetterStatus.REPLAYING.code(), claimToken, ids, DeadLetterStatus.PENDING.code()));
        if (claimed == 0) {
            return List.of();
        }
        String selectSql = "SELECT " + COLUMNS_WITH_RAW + " FROM " + tableName() +
                " WHERE claimed_by=? AND status=? ORDER BY id";
        return JdbcTemplate.query(conn, selectSql, ENTRY_WITH_RAW_MAPPER,
                claimToken, DeadLetterStatus.REPLAYING.code());
    }

    @Override
    public int markReplayed(Connection conn, Collection<Long> ids, String claimToken, Instant now) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE " + tableName() +
                " SET status=?, replayed_at=?, replay_count=replay_count+1, claimed_by=NULL" +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND status=? AND claimed_by=?";
        return JdbcTemplate.update(conn, sql, params(DeadLetterStatus.REPLAYED.code(), Timestamp.from(now),
                ids, DeadLetterStatus.REPLAYING.code(), claimToken));
    }

    @Override
    public int releaseClaim(Connection conn, Collection<Long> ids, String claimToken) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE " + tableName() + " SET status=?, claimed_by=NULL" +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND status=? AND claimed_by=?";
        return JdbcTemplate.update(conn, sql, params(DeadLetterStatus.PENDING.code(),
                ids, DeadLetterStatus.REPLAYING.code(), claimToken));
    }

    @Override
    public int acknowledge(Connection conn, Collection<Long> ids, Instant now) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE " + tableName() + " SET status=?, acknowledged_at=?" +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND status=?";
        return JdbcTemplate.update(conn, sql, params(DeadLetterStatus.ACKNOWLEDGED.code(), Timestamp.from(now),
                ids, DeadLetterStatus.PENDING.code()));
    }

    @Override
    public int purgeTerminal(Connection conn, DeadLetterStatus status, Instant cutoff, int limit) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Only terminal statuses can be purged: " + status);
        }
        String column = transitionColumn(status);
        String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
                "SELECT id FROM " + tableName() +
                " WHERE status=? AND " + column + " < ?" +
                " ORDER BY " + column + " LIMIT ?)";
        return JdbcTemplate.update(conn, sql, status.code(), Timestamp.from(cutoff), limit);
    }

    /**
     * Builds a WHERE clause for the optional status and record filters, appending
     * bind values to {@code params}. Returns an empty string when neither is set.
     */
    protected static String where(DeadLetterStatus status, String recordId, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (status != null) {
            clauses.add("status=?");
            params.add(status.code());
        }
        if (recordId != null) {
            clauses.add("record_id=?");
            params.add(recordId);
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    /**
     * Flattens scalars and collections into one bind array, in order.
     */
    protected static Object[] params(Object... values) {
        List<Object> flat = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Collection<?> c) {
                flat.addAll(c);
            } else {
                flat.add(value);
            }
        }
        return flat.toArray();
    }

    private static String transitionColumn(DeadLetterStatus status) {
        return switch (status) {
            case REPLAYED -> "replayed_at";
            case ACKNOWLEDGED -> "acknowledged_at";
            case PENDING, REPLAYING -> "failed_at";
        };
    }

    protected static String truncateReason(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static DeadLetterEntry mapEntry(ResultSet rs, boolean withRaw) throws SQLException {
        return new DeadLetterEntry(
                rs.getLong("id"),
                rs.getString("message_id"),
                rs.getString("record_id"),
                rs.getString("name"),
                rs.getString("brewer"),
                rs.getString("failure_reason"),
                rs.getTimestamp("failed_at").toInstant(),
                rs.getInt("failure_count"),
                rs.getString("source_queue"),
                DeadLetterStatus.fromCode(rs.getString("status")),
                rs.getInt("replay_count"),
                toInstant(rs.getTimestamp("replayed_at")),
                toInstant(rs.getTimestamp("acknowledged_at")),
                withRaw ? rs.getString("raw_message") : null);
    }
}
