package io.governor.jdbc.catalog;

import io.governor.jdbc.JdbcTemplate;
import io.governor.jdbc.TableNames;
import io.governor.model.CatalogRecord;
import io.governor.model.DeadLetterStatus;
import io.governor.model.EnrichmentStatus;
import io.governor.spi.CatalogStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog store over plain SQL, shared by every dialect.
 *
 * <p>All status writes are conditional on {@code enrichment_status = 'pending'},
 * so a record resolved by one consumer is never overwritten by another.
 */
public final class JdbcCatalogStore implements CatalogStore {
    private static final String COLUMNS = "id, name, attribute_hint, enrichment_status";

    private static final JdbcTemplate.RowMapper<CatalogRecord> RECORD_MAPPER = rs -> new CatalogRecord(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("attribute_hint"),
            EnrichmentStatus.fromCode(rs.getString("enrichment_status")));

    private final String catalogTable;
    private final String deadLetterTable;

    public JdbcCatalogStore() {
        this(TableNames.CATALOG, TableNames.DEAD_LETTER);
    }

    public JdbcCatalogStore(String catalogTable, String deadLetterTable) {
        this.catalogTable = TableNames.validate(catalogTable);
        this.deadLetterTable = TableNames.validate(deadLetterTable);
    }

    @Override
    public List<CatalogRecord> findEligible(Connection conn, int limit, boolean excludeOpenDeadLetters) {
        if (limit <= 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(" FROM ").append(catalogTable).append(" c")
                .append(" WHERE c.enrichment_status=?");
        if (excludeOpenDeadLetters) {
            sql.append(" AND NOT EXISTS (SELECT 1 FROM ").append(deadLetterTable).append(" d")
                    .append(" WHERE d.record_id = c.id AND d.status=?)");
        }
        sql.append(" ORDER BY c.id LIMIT ?");
        if (excludeOpenDeadLetters) {
            return JdbcTemplate.query(conn, sql.toString(), RECORD_MAPPER,
                    EnrichmentStatus.PENDING.code(), DeadLetterStatus.PENDING.code(), limit);
        }
        return JdbcTemplate.query(conn, sql.toString(), RECORD_MAPPER, EnrichmentStatus.PENDING.code(), limit);
    }

    @Override
    public int markSkipped(Connection conn, Collection<String> ids, Instant now) {
        if (ids.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE " + catalogTable + " SET enrichment_status=?, updated_at=?" +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND enrichment_status=?";
        Object[] params = new Object[ids.size() + 3];
        params[0] = EnrichmentStatus.SKIPPED.code();
        params[1] = Timestamp.from(now);
        int i = 2;
        for (String id : ids) {
            params[i++] = id;
        }
        params[i] = EnrichmentStatus.PENDING.code();
        return JdbcTemplate.update(conn, sql, params);
    }

    @Override
    public Optional<EnrichmentStatus> findStatus(Connection conn, String id) {
        return JdbcTemplate.query(conn,
                "SELECT enrichment_status FROM " + catalogTable + " WHERE id=?",
                rs -> EnrichmentStatus.fromCode(rs.getString(1)), id).stream().findFirst();
    }

    @Override
    public int markEnriched(Connection conn, String id, double value, double confidence, String source, Instant now) {
        String sql = "UPDATE " + catalogTable +
                " SET enrichment_status=?, derived_attribute=?, confidence=?, source=?," +
                " enriched_at=?, updated_at=?" +
                " WHERE id=? AND enrichment_status=?";
        Timestamp ts = Timestamp.from(now);
        return JdbcTemplate.update(conn, sql, EnrichmentStatus.ENRICHED.code(), value, confidence, source,
                ts, ts, id, EnrichmentStatus.PENDING.code());
    }

    @Override
    public int markNotFound(Connection conn, String id, Instant now) {
        String sql = "UPDATE " + catalogTable + " SET enrichment_status=?, updated_at=?" +
                " WHERE id=? AND enrichment_status=?";
        return JdbcTemplate.update(conn, sql, EnrichmentStatus.NOT_FOUND.code(), Timestamp.from(now),
                id, EnrichmentStatus.PENDING.code());
    }

    @Override
    public Map<EnrichmentStatus, Integer> countByStatus(Connection conn) {
        Map<EnrichmentStatus, Integer> counts = new EnumMap<>(EnrichmentStatus.class);
        for (EnrichmentStatus status : EnrichmentStatus.values()) {
            counts.put(status, 0);
        }
        JdbcTemplate.query(conn,
                "SELECT enrichment_status, COUNT(*) FROM " + catalogTable + " GROUP BY enrichment_status",
                rs -> {
                    EnrichmentStatus status = EnrichmentStatus.fromCode(rs.getString(1));
                    counts.put(status, Math.toIntExact(rs.getLong(2)));
                    return status;
                });
        return counts;
    }
}
