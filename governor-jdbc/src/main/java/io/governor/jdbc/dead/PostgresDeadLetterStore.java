package io.governor.jdbc.dead;

import io.governor.jdbc.JdbcTemplate;
import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterRecord;
import io.governor.model.DeadLetterStatus;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;

/**
 * PostgreSQL dead-letter store.
 *
 * <p>Ingestion is a single {@code INSERT ... ON CONFLICT (message_id) DO UPDATE}.
 * Replay claims use {@code UPDATE ... RETURNING} so the claimed rows come back
 * from the same statement that moved them.
 */
public final class PostgresDeadLetterStore extends AbstractJdbcDeadLetterStore {
    public PostgresDeadLetterStore() {
        super();
    }

    public PostgresDeadLetterStore(String tableName) {
        super(tableName);
    }

    @Override
    public void ingest(Connection conn, DeadLetterRecord record, Instant failedAt) {
        String sql = "INSERT INTO " + tableName() + " (" +
                "message_id, record_id, name, brewer, failure_reason, failed_at, failure_count, " +
                "source_queue, status, replay_count, raw_message" +
                ") VALUES (?,?,?,?,?,?,?,?,?,0,?)" +
                " ON CONFLICT (message_id) DO UPDATE SET" +
                " record_id = EXCLUDED.record_id, name = EXCLUDED.name, brewer = EXCLUDED.brewer," +
                " failure_reason = EXCLUDED.failure_reason, failed_at = EXCLUDED.failed_at," +
                " failure_count = EXCLUDED.failure_count, source_queue = EXCLUDED.source_queue," +
                " status = EXCLUDED.status, raw_message = EXCLUDED.raw_message, claimed_by = NULL";
        JdbcTemplate.update(conn, sql,
                record.messageId(), record.recordId(), record.name(), record.brewer(), truncateReason(record.failureReason()),
                Timestamp.from(failedAt.truncatedTo(ChronoUnit.MILLIS)), record.failureCount(),
                record.sourceQueue(), DeadLetterStatus.PENDING.code(), record.rawMessage());
    }

    @Override
    public List<DeadLetterEntry> claimForReplay(Connection conn, Collection<Long> ids, String claimToken, Instant now) {
        if (ids.isEmpty()) {
            return List.of();
        }
        String sql = "UPDATE " + tableName() + " SET status=?, claimed_by=?" +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND status=?" +
                " RETURNING " + COLUMNS_WITH_RAW;
        return JdbcTemplate.updateReturning(conn, sql, ENTRY_WITH_RAW_MAPPER,
                params(DeadLetterStatus.REPLAYING.code(), claimToken, ids, DeadLetterStatus.PENDING.code()));
    }
}
