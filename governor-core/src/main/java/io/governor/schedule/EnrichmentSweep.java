package io.governor.schedule;

import io.governor.StoreUnavailableException;
import io.governor.blocklist.EnrichmentBlocklist;
import io.governor.breaker.QuotaCircuitBreaker;
import io.governor.breaker.QuotaStatus;
import io.governor.breaker.SkipReason;
import io.governor.config.GovernorConfig;
import io.governor.model.CatalogRecord;
import io.governor.model.EnrichmentJob;
import io.governor.queue.JobQueue;
import io.governor.spi.CatalogStore;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.GovernorMetrics;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discovers pending catalog records and enqueues enrichment jobs within budget.
 *
 * <p>Each sweep runs the breaker, sizes the batch as
 * {@code min(requested, dailyRemaining, monthlyRemaining, queue max batch)}, loads
 * that many pending records, marks blocklisted ones {@code skipped} in one write
 * and enqueues the rest. Every outcome, including each skip reason, is reported to
 * {@link GovernorMetrics} together with the budget left once the sweep's jobs are
 * queued. Budget the breaker did not read is reported as zero.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EnrichmentSweep {
    private static final Logger logger = Logger.getLogger(EnrichmentSweep.class.getName());

    private final ConnectionProvider connectionProvider;
    private final QuotaCircuitBreaker breaker;
    private final CatalogStore catalogStore;
    private final JobQueue queue;
    private final EnrichmentBlocklist blocklist;
    private final Supplier<GovernorConfig> config;
    private final GovernorMetrics metrics;
    private final Clock clock;

    private EnrichmentSweep(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.breaker = Objects.requireNonNull(builder.breaker, "breaker");
        this.catalogStore = Objects.requireNonNull(builder.catalogStore, "catalogStore");
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.config = Objects.requireNonNull(builder.config, "config");
        this.blocklist = builder.blocklist != null ? builder.blocklist : EnrichmentBlocklist.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : GovernorMetrics.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Scheduled sweep: asks for a full enqueue batch and includes every pending record. */
    public SweepReport runOnce() {
        GovernorConfig cfg = config.get();
        return sweep(cfg, cfg.maxEnqueueBatch(), false);
    }

    /**
     * Operator-triggered sweep.
     *
     * @param requestedLimit  jobs wanted, clamped to {@code [1, maxEnqueueBatch]}
     * @param excludeFailures skip records that already have a pending dead letter
     */
    public SweepReport trigger(int requestedLimit, boolean excludeFailures) {
        GovernorConfig cfg = config.get();
        int requested = Math.max(1, Math.min(requestedLimit, cfg.maxEnqueueBatch()));
        return sweep(cfg, requested, excludeFailures);
    }

    private SweepReport sweep(GovernorConfig cfg, int requested, boolean excludeFailures) {
        QuotaStatus quota = breaker.evaluate(cfg);
        if (!quota.canProcess()) {
            return skip(quota.skipReason(), requested, 0, 0, excludeFailures, quota);
        }

        int effective = Math.min(Math.min(requested, quota.dailyRemaining()),
                Math.min(quota.monthlyRemaining(), queue.maxBatchSize()));

        EnrichmentBlocklist.Partition partition;
        try (Connection conn = connectionProvider.getConnection()) {
            List<CatalogRecord> records = catalogStore.findEligible(conn, effective, excludeFailures);
            if (records.isEmpty()) {
                return skip(SkipReason.NO_ELIGIBLE_RECORDS, requested, effective, 0, excludeFailures, quota);
            }
            partition = blocklist.partition(records);
            if (!partition.blocked().isEmpty()) {
                catalogStore.markSkipped(conn, partition.blockedIds(), clock.instant());
                logger.log(Level.INFO, "Marked {0} blocklisted records skipped", partition.blocked().size());
            }
        } catch (SQLException | StoreUnavailableException e) {
            logger.log(Level.SEVERE, "Catalog unavailable during sweep", e);
            return skip(SkipReason.STORE_UNAVAILABLE, requested, effective, 0, excludeFailures, quota);
        }

        int blocked = partition.blocked().size();
        if (partition.eligible().isEmpty()) {
            return skip(SkipReason.NO_ELIGIBLE_RECORDS, requested, effective, blocked, excludeFailures, quota);
        }

        int queued = enqueue(partition.eligible());
        metrics.recordSweep(queued, blocked);
        metrics.recordRemainingBudget(Math.max(0, quota.dailyRemaining() - queued),
                Math.max(0, quota.monthlyRemaining() - queued));
        SweepReport report = new SweepReport(null, requested, effective, queued, blocked, excludeFailures, quota);
        logger.log(Level.INFO, "Sweep queued {0} jobs ({1} blocked), daily remaining {2}, monthly remaining {3}",
                new Object[]{queued, blocked, report.dailyRemaining(), report.monthlyRemaining()});
        return report;
    }

    private int enqueue(List<CatalogRecord> records) {
        int chunkSize = queue.maxBatchSize();
        int queued = 0;
        for (int from = 0; from < records.size(); from += chunkSize) {
            List<EnrichmentJob> chunk = records.subList(from, Math.min(records.size(), from + chunkSize))
                    .stream()
                    .map(CatalogRecord::toJob)
                    .toList();
            try {
                queue.sendBatch(chunk);
                queued += chunk.size();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to enqueue " + chunk.size() + " jobs; next sweep retries them", e);
                break;
            }
        }
        return queued;
    }

    private SweepReport skip(SkipReason reason, int requested, int effective, int blocked,
                             boolean excludeFailures, QuotaStatus quota) {
        metrics.incrementSkipped(reason);
        metrics.recordRemainingBudget(quota.dailyRemaining(), quota.monthlyRemaining());
        if (blocked > 0) {
            metrics.recordSweep(0, blocked);
        }
        logger.log(Level.INFO, "Sweep skipped: {0}", reason.code());
        return new SweepReport(reason, requested, effective, 0, blocked, excludeFailures, quota);
    }

    /** Builder for {@link EnrichmentSweep}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private QuotaCircuitBreaker breaker;
        private CatalogStore catalogStore;
        private JobQueue queue;
        private EnrichmentBlocklist blocklist;
        private Supplier<GovernorConfig> config;
        private GovernorMetrics metrics;
        private Clock clock;

        private Builder() {}

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder breaker(QuotaCircuitBreaker breaker) {
            this.breaker = breaker;
            return this;
        }

        public Builder catalogStore(CatalogStore catalogStore) {
            this.catalogStore = catalogStore;
            return this;
        }

        public Builder queue(JobQueue queue) {
            this.queue = queue;
            return this;
        }

        /** Optional. Defaults to {@link EnrichmentBlocklist#defaults()}. */
        public Builder blocklist(EnrichmentBlocklist blocklist) {
            this.blocklist = blocklist;
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

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EnrichmentSweep build() {
            return new EnrichmentSweep(this);
        }
    }
}
