package io.governor.spi;

import io.governor.model.CatalogRecord;
import io.governor.model.EnrichmentStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and updates the enrichment state of catalog records.
 *
 * <p>{@code enrichment_status} is the single eligibility signal: only
 * {@link EnrichmentStatus#PENDING} records are ever returned by
 * {@link #findEligible}.
 */
public interface CatalogStore {

    /**
     * Returns up to {@code limit} pending records ordered by id.
     *
     * @param excludeOpenDeadLetters also skip records that have a {@code pending}
     *                               dead-letter entry
     */
    List<CatalogRecord> findEligible(Connection conn, int limit, boolean excludeOpenDeadLetters);

    /**
     * Marks the given records {@code skipped} in a single statement. Only pending
     * records are touched.
     *
     * @return rows updated
     */
    int markSkipped(Connection conn, Collection<String> ids, Instant now);

    Optional<EnrichmentStatus> findStatus(Connection conn, String id);

    int markEnriched(Connection conn, String id, double value, double confidence, String source, Instant now);

    int markNotFound(Connection conn, String id, Instant now);

    /** Record counts per status; statuses with no rows are present with zero. */
    Map<EnrichmentStatus, Integer> countByStatus(Connection conn);
}
