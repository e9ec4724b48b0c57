package io.governor.schedule;

import io.governor.StoreUnavailableException;
import io.governor.breaker.BudgetPeriods;
import io.governor.config.GovernorConfig;
import io.governor.model.DeadLetterStatus;
import io.governor.spi.BudgetLedger;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.DeadLetterStore;
import io.governor.spi.GovernorMetrics;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes expired ledger rows and terminal dead letters in bounded batches.
 *
 * <p>Three independent passes: ledger days older than
 * {@link GovernorConfig#ledgerRetention()}, then {@code acknowledged} and
 * {@code replayed} dead letters older than {@link GovernorConfig#deadLetterRetention()}
 * by their own timestamps. Each pass deletes {@link GovernorConfig#cleanupBatchSize()}
 * rows at a time and stops at the first short batch. Each batch runs on its own
 * auto-committed connection. A failing pass is logged and does not stop the others.
 */
public final class RetentionCleaner {
    private static final Logger logger = Logger.getLogger(RetentionCleaner.class.getName());

    private final ConnectionProvider connectionProvider;
    private final BudgetLedger ledger;
    private final DeadLetterStore deadLetterStore;
    private final Supplier<GovernorConfig> config;
    private final GovernorMetrics metrics;
    private final Clock clock;

    private RetentionCleaner(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
        this.deadLetterStore = Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
        this.config = Objects.requireNonNull(builder.config, "config");
        this.metrics = builder.metrics != null ? builder.metrics : GovernorMetrics.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public CleanupReport runOnce() {
        GovernorConfig cfg = config.get();
        Instant now = clock.instant();
        int batchSize = cfg.cleanupBatchSize();

        String ledgerKey = BudgetPeriods.retentionKey(now, cfg.ledgerRetention());
        long ledgerDeleted = drain("ledger", batchSize,
                conn -> ledger.purgeBefore(conn, ledgerKey, batchSize));

        Instant deadLetterCutoff = now.minus(cfg.deadLetterRetention());
        long acknowledgedDeleted = drain(DeadLetterStatus.ACKNOWLEDGED.code(), batchSize,
                conn -> deadLetterStore.purgeTerminal(conn, DeadLetterStatus.ACKNOWLEDGED, deadLetterCutoff, batchSize));
        long replayedDeleted = drain(DeadLetterStatus.REPLAYED.code(), batchSize,
                conn -> deadLetterStore.purgeTerminal(conn, DeadLetterStatus.REPLAYED, deadLetterCutoff, batchSize));

        CleanupReport report = new CleanupReport(ledgerDeleted, acknowledgedDeleted, replayedDeleted);
        if (report.total() > 0) {
            logger.log(Level.INFO, "Retention cleanup removed {0} ledger rows, {1} acknowledged and {2} replayed dead letters",
                    new Object[]{ledgerDeleted, acknowledgedDeleted, replayedDeleted});
        }
        return report;
    }

    private long drain(String target, int batchSize, BatchDelete delete) {
        long total = 0;
        int deleted;
        do {
            deleted = deleteBatch(target, delete);
            total += deleted;
        } while (deleted >= batchSize);
        metrics.recordCleanup(target, (int) Math.min(Integer.MAX_VALUE, total));
        return total;
    }

    private int deleteBatch(String target, BatchDelete delete) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return delete.apply(conn);
        } catch (SQLException | StoreUnavailableException e) {
            logger.log(Level.SEVERE, "Retention cleanup of " + target + " failed", e);
            return 0;
        }
    }

    @FunctionalInterface
    private interface BatchDelete {
        int apply(Connection conn);
    }

    /** Builder for {@link RetentionCleaner}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private BudgetLedger ledger;
        private DeadLetterStore deadLetterStore;
        private Supplier<GovernorConfig> config;
        private GovernorMetrics metrics;
        private Clock clock;

        private Builder() {}

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder ledger(BudgetLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
            this.deadLetterStore = deadLetterStore;
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

        public RetentionCleaner build() {
            return new RetentionCleaner(this);
        }
    }
}
