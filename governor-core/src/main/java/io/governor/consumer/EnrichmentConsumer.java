package io.governor.consumer;

import io.governor.EnrichmentApiException;
import io.governor.StoreUnavailableException;
import io.governor.breaker.QuotaCircuitBreaker;
import io.governor.breaker.QuotaStatus;
import io.governor.breaker.SkipReason;
import io.governor.config.GovernorConfig;
import io.governor.model.EnrichmentJob;
import io.governor.model.EnrichmentStatus;
import io.governor.model.Reservation;
import io.governor.queue.QueueMessage;
import io.governor.spi.CatalogStore;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.EnrichmentClient;
import io.governor.spi.GovernorMetrics;
import io.governor.util.Sleeper;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Processes one delivered batch of {@link EnrichmentJob} messages.
 *
 * <p>The kill switch and monthly ceiling are checked once per batch. If either
 * trips, every message is acked; retrying would only fail the same check later.
 * If the ledger cannot be read, every message is retried instead.
 *
 * <p>Messages are then handled one at a time, in delivery order, with a fixed
 * pause between external calls. Per message:
 * <ul>
 *   <li>a record that is no longer pending is acked without spending budget;</li>
 *   <li>a refused daily reservation is acked (the next sweep picks it up);</li>
 *   <li>a value updates the record, no answer marks it {@code not_found};</li>
 *   <li>a rate-limit failure is retried with the extended delay, any other
 *       failure with the default delay.</li>
 * </ul>
 * A granted reservation is never refunded, so failures still consume budget.
 * Nothing escapes {@link #handleBatch}: one message's failure never affects another.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EnrichmentConsumer {
    private static final Logger logger = Logger.getLogger(EnrichmentConsumer.class.getName());

    private final ConnectionProvider connectionProvider;
    private final CatalogStore catalogStore;
    private final QuotaCircuitBreaker breaker;
    private final EnrichmentClient client;
    private final Supplier<GovernorConfig> config;
    private final GovernorMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;

    private EnrichmentConsumer(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.catalogStore = Objects.requireNonNull(builder.catalogStore, "catalogStore");
        this.breaker = Objects.requireNonNull(builder.breaker, "breaker");
        this.client = Objects.requireNonNull(builder.client, "client");
        this.config = Objects.requireNonNull(builder.config, "config");
        this.metrics = builder.metrics != null ? builder.metrics : GovernorMetrics.NOOP;
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BatchOutcome handleBatch(List<? extends QueueMessage> messages) {
        GovernorConfig cfg = config.get();
        Tally tally = new Tally(messages.size());
        if (messages.isEmpty()) {
            return tally.toOutcome(null);
        }

        QuotaStatus gate = breaker.checkBatch(cfg);
        if (!gate.canProcess()) {
            SkipReason reason = gate.skipReason();
            metrics.incrementSkipped(reason);
            if (reason == SkipReason.STORE_UNAVAILABLE) {
                logger.log(Level.WARNING, "Ledger unavailable, retrying batch of {0}", messages.size());
                messages.forEach(m -> retry(m, cfg.defaultRetryDelay(), tally));
            } else {
                logger.log(Level.INFO, "Batch of {0} skipped: {1}",
                        new Object[]{messages.size(), reason.code()});
                messages.forEach(m -> ack(m, tally));
            }
            return tally.toOutcome(reason);
        }

        boolean calledBefore = false;
        for (int i = 0; i < messages.size(); i++) {
            QueueMessage message = messages.get(i);
            try {
                calledBefore |= process(message, cfg, calledBefore, tally);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.log(Level.WARNING, "Interrupted, retrying {0} remaining messages", messages.size() - i);
                for (QueueMessage remaining : messages.subList(i, messages.size())) {
                    retry(remaining, cfg.defaultRetryDelay(), tally);
                }
                break;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected failure handling message " + message.id(), e);
                tally.failed++;
                retry(message, cfg.defaultRetryDelay(), tally);
            }
        }
        return tally.toOutcome(null);
    }

    /**
     * @return whether the external service was called for this message
     */
    private boolean process(QueueMessage message, GovernorConfig cfg, boolean calledBefore, Tally tally)
            throws InterruptedException {
        EnrichmentJob job = message.job();

        Optional<EnrichmentStatus> status;
        try {
            status = readStatus(job.recordId());
        } catch (StoreUnavailableException e) {
            logger.log(Level.WARNING, "Catalog unavailable for record " + job.recordId(), e);
            tally.failed++;
            retry(message, cfg.defaultRetryDelay(), tally);
            return false;
        }
        if (status.isEmpty() || status.get() != EnrichmentStatus.PENDING) {
            logger.log(Level.FINE, "Record {0} no longer pending ({1}), acking",
                    new Object[]{job.recordId(), status.map(EnrichmentStatus::code).orElse("missing")});
            tally.alreadyResolved++;
            ack(message, tally);
            return false;
        }

        Reservation reservation;
        try {
            reservation = breaker.reserve(cfg);
        } catch (StoreUnavailableException e) {
            logger.log(Level.WARNING, "Reservation failed for record " + job.recordId(), e);
            tally.failed++;
            retry(message, cfg.defaultRetryDelay(), tally);
            return false;
        }
        if (!reservation.reserved()) {
            logger.log(Level.FINE, "Daily budget exhausted, acking record {0}", job.recordId());
            metrics.incrementOverBudget();
            tally.overBudget++;
            ack(message, tally);
            return false;
        }

        if (calledBefore) {
            sleeper.sleep(cfg.interCallDelay());
        }

        OptionalDouble value;
        try {
            value = client.lookup(job);
        } catch (EnrichmentApiException e) {
            metrics.incrementLookupFailure(e.isRateLimited());
            if (e.isRateLimited()) {
                logger.log(Level.WARNING, "Rate limited on record {0}, retrying in {1}",
                        new Object[]{job.recordId(), cfg.rateLimitRetryDelay()});
                tally.rateLimited++;
                retry(message, cfg.rateLimitRetryDelay(), tally);
            } else {
                logger.log(Level.WARNING, "Lookup failed with status " + e.statusCode() +
                        " for record " + job.recordId(), e);
                tally.failed++;
                retry(message, cfg.defaultRetryDelay(), tally);
            }
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Lookup failed for record " + job.recordId(), e);
            metrics.incrementLookupFailure(false);
            tally.failed++;
            retry(message, cfg.defaultRetryDelay(), tally);
            return true;
        }

        try (Connection conn = connectionProvider.getConnection()) {
            if (value.isPresent()) {
                catalogStore.markEnriched(conn, job.recordId(), value.getAsDouble(),
                        cfg.confidence(), client.sourceName(), clock.instant());
                metrics.incrementEnriched();
                tally.enriched++;
            } else {
                catalogStore.markNotFound(conn, job.recordId(), clock.instant());
                metrics.incrementNotFound();
                tally.notFound++;
            }
        } catch (SQLException | StoreUnavailableException e) {
            logger.log(Level.WARNING, "Failed to record lookup result for record " + job.recordId(), e);
            tally.failed++;
            retry(message, cfg.defaultRetryDelay(), tally);
            return true;
        }
        ack(message, tally);
        return true;
    }

    private Optional<EnrichmentStatus> readStatus(String recordId) {
        try (Connection conn = connectionProvider.getConnection()) {
            return catalogStore.findStatus(conn, recordId);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to obtain connection for status lookup", e);
        }
    }

    private static void ack(QueueMessage message, Tally tally) {
        message.ack();
        tally.acked++;
    }

    private static void retry(QueueMessage message, Duration delay, Tally tally) {
        message.retry(delay);
        tally.retried++;
    }

    private static final class Tally {
        final int received;
        int acked;
        int retried;
        int enriched;
        int notFound;
        int alreadyResolved;
        int overBudget;
        int rateLimited;
        int failed;

        Tally(int received) {
            this.received = received;
        }

        BatchOutcome toOutcome(SkipReason reason) {
            return new BatchOutcome(received, acked, retried, enriched, notFound,
                    alreadyResolved, overBudget, rateLimited, failed, reason);
        }
    }

    /** Builder for {@link EnrichmentConsumer}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private CatalogStore catalogStore;
        private QuotaCircuitBreaker breaker;
        private EnrichmentClient client;
        private Supplier<GovernorConfig> config;
        private GovernorMetrics metrics;
        private Sleeper sleeper;
        private Clock clock;

        private Builder() {}

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder catalogStore(CatalogStore catalogStore) {
            this.catalogStore = catalogStore;
            return this;
        }

        /** <b>Required.</b> */
        public Builder breaker(QuotaCircuitBreaker breaker) {
            this.breaker = breaker;
            return this;
        }

        /** <b>Required.</b> */
        public Builder client(EnrichmentClient client) {
            this.client = client;
            return this;
        }

        /** <b>Required.</b> Read once at the start of every batch. */
        public Builder config(Supplier<GovernorConfig> config) {
            this.config = config;
            return this;
        }

        public Builder config(GovernorConfig config) {
            Objects.requireNonNull(config, "config");
            this.config = () -> config;
            return this;
        }

        /** Optional. Defaults to {@link GovernorMetrics#NOOP}. */
        public Builder metrics(GovernorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to {@link Sleeper#SYSTEM}. */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /** Optional. Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EnrichmentConsumer build() {
            return new EnrichmentConsumer(this);
        }
    }
}
