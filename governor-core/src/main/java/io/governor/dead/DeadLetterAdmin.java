package io.governor.dead;

import io.governor.StoreUnavailableException;
import io.governor.config.GovernorConfig;
import io.governor.dead.AdminRequestException.ErrorCode;
import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterStatus;
import io.governor.model.EnrichmentJob;
import io.governor.model.PageCursor;
import io.governor.queue.JobQueue;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.DeadLetterQuery;
import io.governor.spi.DeadLetterStore;
import io.governor.spi.GovernorMetrics;
import io.governor.util.JsonCodec;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade over the {@link DeadLetterStore}: list, stats, replay and
 * acknowledge.
 *
 * <p>Replay is a two-phase optimistic protocol. Rows are first claimed with a
 * conditional {@code pending -> replaying} update tagged with a per-call token, so
 * overlapping replay calls claim disjoint rows. Each claimed row is then
 * re-enqueued under its original message id and resolved to {@code replayed},
 * or returned to {@code pending} if its payload is malformed or the send fails.
 * No row is left in {@code replaying} when the call returns.
 *
 * <p>Validation failures and store outages surface as {@link AdminRequestException}.
 */
public final class DeadLetterAdmin {
    private static final Logger logger = Logger.getLogger(DeadLetterAdmin.class.getName());

    static final int STATS_TOP_N = 10;

    private final ConnectionProvider connectionProvider;
    private final DeadLetterStore store;
    private final JobQueue queue;
    private final Supplier<GovernorConfig> config;
    private final GovernorMetrics metrics;
    private final JsonCodec jsonCodec;
    private final CursorCodec cursorCodec;
    private final Clock clock;

    private DeadLetterAdmin(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.config = Objects.requireNonNull(builder.config, "config");
        this.metrics = builder.metrics != null ? builder.metrics : GovernorMetrics.NOOP;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.cursorCodec = new CursorCodec(jsonCodec);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lists one page ordered by {@code failed_at DESC, id DESC}.
     *
     * @throws AdminRequestException {@code INVALID_CURSOR} for an unreadable cursor,
     *     {@code INVALID_REQUEST} for an unknown status or a limit below one
     */
    public DeadLetterPage list(ListRequest request) {
        Objects.requireNonNull(request, "request");
        DeadLetterStatus status = resolveStatus(request.status());
        if (request.limit() < 1) {
            throw new AdminRequestException(ErrorCode.INVALID_REQUEST, "limit must be >= 1");
        }
        int limit = Math.min(request.limit(), ListRequest.MAX_LIMIT);
        PageCursor after = isBlank(request.cursor()) ? null : cursorCodec.decode(request.cursor());
        String recordId = isBlank(request.recordId()) ? null : request.recordId();

        try (Connection conn = connectionProvider.getConnection()) {
            List<DeadLetterEntry> rows = store.list(conn,
                    new DeadLetterQuery(status, recordId, after, limit + 1, request.includeRaw()));
            int total = store.count(conn, status, recordId);
            boolean hasMore = rows.size() > limit;
            List<DeadLetterEntry> page = hasMore ? List.copyOf(rows.subList(0, limit)) : List.copyOf(rows);
            String nextCursor = hasMore
                    ? cursorCodec.encode(PageCursor.after(page.get(page.size() - 1)))
                    : null;
            return new DeadLetterPage(page, total, nextCursor, hasMore);
        } catch (SQLException | StoreUnavailableException e) {
            throw unavailable("list dead letters", e);
        }
    }

    public DeadLetterStats stats() {
        Instant now = clock.instant();
        Instant dayAgo = now.minus(Duration.ofHours(24));
        try (Connection conn = connectionProvider.getConnection()) {
            Map<DeadLetterStatus, Integer> byStatus = store.countByStatus(conn);
            Double oldestAge = store.oldestPendingFailedAt(conn)
                    .map(failedAt -> ageInHours(failedAt, now))
                    .orElse(null);
            List<DeadLetterEntry> repeats = store.repeatFailures(conn, STATS_TOP_N).stream()
                    .map(DeadLetterEntry::withoutRawMessage)
                    .toList();
            DeadLetterStats.Last24h last24h = new DeadLetterStats.Last24h(
                    store.countEnteredSince(conn, DeadLetterStatus.REPLAYED, dayAgo),
                    store.countEnteredSince(conn, DeadLetterStatus.ACKNOWLEDGED, dayAgo),
                    store.countFailedSince(conn, dayAgo));
            return new DeadLetterStats(byStatus, oldestAge,
                    store.topFailingSources(conn, STATS_TOP_N), repeats, last24h);
        } catch (SQLException | StoreUnavailableException e) {
            throw unavailable("compute dead-letter stats", e);
        }
    }

    /**
     * Re-enqueues pending dead letters.
     *
     * @param ids   row ids; duplicates are ignored and at most
     *              {@link GovernorConfig#maxReplayBatch()} are considered
     * @param delay initial delivery delay, {@code null} for none
     * @throws AdminRequestException {@code INVALID_REQUEST} for a missing id list or a
     *     negative delay, {@code INVALID_ID} for a non-positive id,
     *     {@code STORE_UNAVAILABLE} if rows could not be claimed
     */
    public ReplayResult replay(Collection<Long> ids, Duration delay) {
        List<Long> batch = validateIds(ids, config.get().maxReplayBatch());
        Duration sendDelay = delay != null ? delay : Duration.ZERO;
        if (sendDelay.isNegative()) {
            throw new AdminRequestException(ErrorCode.INVALID_REQUEST, "delay must be >= 0");
        }
        String claimToken = UUID.randomUUID().toString();

        try (Connection conn = connectionProvider.getConnection()) {
            boolean resolved = false;
            try {
                List<DeadLetterEntry> claimed = store.claimForReplay(conn, batch, claimToken, clock.instant());
                List<Long> sent = new ArrayList<>();
                List<Long> failed = new ArrayList<>();
                for (DeadLetterEntry entry : claimed) {
                    if (enqueue(entry, sendDelay)) {
                        sent.add(entry.id());
                    } else {
                        failed.add(entry.id());
                    }
                }
                int replayed = sent.isEmpty() ? 0 : store.markReplayed(conn, sent, claimToken, clock.instant());
                if (!failed.isEmpty()) {
                    store.releaseClaim(conn, failed, claimToken);
                }
                resolved = true;

                metrics.recordReplay(replayed, failed.size());
                logger.log(Level.INFO, "Replay requested={0} claimed={1} replayed={2} failed={3}",
                        new Object[]{batch.size(), claimed.size(), replayed, failed.size()});
                return new ReplayResult(batch.size(), claimed.size(), replayed, failed.size());
            } finally {
                if (!resolved) {
                    releaseAfterFailure(conn, batch, claimToken);
                }
            }
        } catch (SQLException | StoreUnavailableException e) {
            throw unavailable("replay dead letters", e);
        }
    }

    /**
     * Dismisses pending dead letters. Rows claimed or resolved concurrently are
     * silently excluded from the count.
     *
     * @param ids row ids; at most {@link GovernorConfig#maxAcknowledgeBatch()} are considered
     * @return rows acknowledged by this call
     */
    public int acknowledge(Collection<Long> ids) {
        List<Long> batch = validateIds(ids, config.get().maxAcknowledgeBatch());
        try (Connection conn = connectionProvider.getConnection()) {
            int acknowledged = store.acknowledge(conn, batch, clock.instant());
            metrics.recordAcknowledged(acknowledged);
            logger.log(Level.INFO, "Acknowledged {0} of {1} dead letters",
                    new Object[]{acknowledged, batch.size()});
            return acknowledged;
        } catch (SQLException | StoreUnavailableException e) {
            throw unavailable("acknowledge dead letters", e);
        }
    }

    public Optional<DeadLetterEntry> find(long id) {
        try (Connection conn = connectionProvider.getConnection()) {
            return store.findById(conn, id);
        } catch (SQLException | StoreUnavailableException e) {
            throw unavailable("load dead letter " + id, e);
        }
    }

    private boolean enqueue(DeadLetterEntry entry, Duration delay) {
        EnrichmentJob job;
        try {
            job = EnrichmentJob.fromJson(entry.rawMessage(), jsonCodec);
        } catch (IllegalArgumentException e) {
            logger.log(Level.WARNING, "Dead letter {0} has a malformed payload: {1}",
                    new Object[]{entry.id(), e.getMessage()});
            return false;
        }
        try {
            queue.resend(entry.messageId(), job, delay);
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to re-enqueue dead letter " + entry.id(), e);
            return false;
        }
    }

    private void releaseAfterFailure(Connection conn, List<Long> ids, String claimToken) {
        try {
            int released = store.releaseClaim(conn, ids, claimToken);
            if (released > 0) {
                logger.log(Level.WARNING, "Returned {0} claimed dead letters to pending", released);
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to release replay claim " + claimToken +
                    "; rows may remain in replaying", e);
        }
    }

    private static List<Long> validateIds(Collection<Long> ids, int max) {
        if (ids == null || ids.isEmpty()) {
            throw new AdminRequestException(ErrorCode.INVALID_REQUEST, "ids must be a non-empty list");
        }
        Set<Long> distinct = new LinkedHashSet<>();
        for (Long id : ids) {
            if (id == null || id <= 0) {
                throw new AdminRequestException(ErrorCode.INVALID_ID, "Invalid dead-letter id: " + id);
            }
            distinct.add(id);
        }
        return distinct.stream().limit(max).toList();
    }

    private static DeadLetterStatus resolveStatus(String status) {
        if (isBlank(status)) {
            return DeadLetterStatus.PENDING;
        }
        if (ListRequest.ALL_STATUSES.equals(status)) {
            return null;
        }
        return DeadLetterStatus.find(status).orElseThrow(() ->
                new AdminRequestException(ErrorCode.INVALID_REQUEST, "Unknown status: " + status));
    }

    static double ageInHours(Instant failedAt, Instant now) {
        double hours = Duration.between(failedAt, now).toMillis() / 3_600_000d;
        return BigDecimal.valueOf(Math.max(0d, hours)).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static AdminRequestException unavailable(String action, Exception cause) {
        logger.log(Level.SEVERE, "Failed to " + action, cause);
        return new AdminRequestException(ErrorCode.STORE_UNAVAILABLE, "Failed to " + action, cause);
    }

    /** Builder for {@link DeadLetterAdmin}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeadLetterStore store;
        private JobQueue queue;
        private Supplier<GovernorConfig> config;
        private GovernorMetrics metrics;
        private JsonCodec jsonCodec;
        private Clock clock;

        private Builder() {}

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder store(DeadLetterStore store) {
            this.store = store;
            return this;
        }

        /** The queue the consumer drains; replayed jobs are sent here. */
        public Builder queue(JobQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder config(Supplier<GovernorConfig> config) {
            this.config = config;
            return this;
        }

        public Builder config(GovernorConfig config) {
            Objects.requireNonNull(config, "config");
            this.config = () -> config;
            return this;
        }

        public Builder metrics(GovernorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DeadLetterAdmin build() {
            return new DeadLetterAdmin(this);
        }
    }
}
