package io.governor.spi;

import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterRecord;
import io.governor.model.DeadLetterStatus;
import io.governor.model.SourceCount;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of jobs that exhausted their queue retry budget.
 *
 * <p>Every state change is a conditional update on {@code status}; the number of
 * rows changed is authoritative, so concurrent admin calls never act on the same
 * row twice.
 *
 * @see io.governor.dead.DeadLetterAdmin
 */
public interface DeadLetterStore {

    /**
     * Inserts a dead letter, or resets an existing one with the same message id to
     * {@code pending} with the new failure details.
     */
    void ingest(Connection conn, DeadLetterRecord record, Instant failedAt);

    /**
     * Returns one page ordered by {@code failed_at DESC, id DESC}.
     */
    List<DeadLetterEntry> list(Connection conn, DeadLetterQuery query);

    /**
     * Counts rows matching the filter, ignoring any cursor.
     */
    int count(Connection conn, DeadLetterStatus status, String recordId);

    Optional<DeadLetterEntry> findById(Connection conn, long id);

    /** Row counts per status; statuses with no rows are present with zero. */
    Map<DeadLetterStatus, Integer> countByStatus(Connection conn);

    /** Earliest {@code failed_at} among pending rows. */
    Optional<Instant> oldestPendingFailedAt(Connection conn);

    /** Sources with the most pending rows, descending. Rows without a source are left out. */
    List<SourceCount> topFailingSources(Connection conn, int limit);

    /** Pending rows with a nonzero replay count, highest count first. */
    List<DeadLetterEntry> repeatFailures(Connection conn, int limit);

    /** Rows that entered {@code status} at or after {@code since}, by that status's timestamp. */
    int countEnteredSince(Connection conn, DeadLetterStatus status, Instant since);

    /** Rows whose {@code failed_at} is at or after {@code since}. */
    int countFailedSince(Connection conn, Instant since);

    /**
     * Moves pending rows among {@code ids} to {@code replaying}, tagging them with
     * {@code claimToken}, and returns exactly the rows this call claimed.
     */
    List<DeadLetterEntry> claimForReplay(Connection conn, Collection<Long> ids, String claimToken, Instant now);

    /**
     * Moves rows claimed under {@code claimToken} to {@code replayed}, incrementing
     * {@code replay_count}.
     */
    int markReplayed(Connection conn, Collection<Long> ids, String claimToken, Instant now);

    /**
     * Returns rows still held under {@code claimToken} to {@code pending}.
     */
    int releaseClaim(Connection conn, Collection<Long> ids, String claimToken);

    /**
     * Moves pending rows among {@code ids} to {@code acknowledged}.
     *
     * @return rows acknowledged by this call
     */
    int acknowledge(Connection conn, Collection<Long> ids, Instant now);

    /**
     * Deletes up to {@code limit} rows in the terminal {@code status} whose
     * transition timestamp is before {@code cutoff}.
     *
     * @throws IllegalArgumentException if {@code status} is not terminal
     */
    int purgeTerminal(Connection conn, DeadLetterStatus status, Instant cutoff, int limit);
}
