package io.governor.dead;

import io.governor.StoreUnavailableException;
import io.governor.config.GovernorConfig;
import io.governor.model.DeadLetterRecord;
import io.governor.model.EnrichmentJob;
import io.governor.queue.DeadLetterSink;
import io.governor.queue.QueueMessage;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.DeadLetterStore;
import io.governor.spi.GovernorMetrics;
import io.governor.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores messages that exhausted their delivery attempts as {@code pending} dead
 * letters. Replay keeps the message id, so a message dead-lettered again after a
 * replay resets its existing row and keeps its replay count.
 */
public final class DeadLetterIngester implements DeadLetterSink {
    private static final Logger logger = Logger.getLogger(DeadLetterIngester.class.getName());

    private final ConnectionProvider connectionProvider;
    private final DeadLetterStore store;
    private final Supplier<GovernorConfig> config;
    private final GovernorMetrics metrics;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    public DeadLetterIngester(ConnectionProvider connectionProvider, DeadLetterStore store,
                              Supplier<GovernorConfig> config, GovernorMetrics metrics, Clock clock) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = metrics != null ? metrics : GovernorMetrics.NOOP;
        this.jsonCodec = JsonCodec.getDefault();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * @throws StoreUnavailableException if the row could not be written
     */
    @Override
    public void accept(QueueMessage message, String reason) {
        EnrichmentJob job = message.job();
        DeadLetterRecord record = new DeadLetterRecord(
                message.id(),
                job.recordId(),
                job.name(),
                job.attributeHint(),
                reason,
                message.attempts(),
                config.get().sourceQueue(),
                job.toJson(jsonCodec));
        try (Connection conn = connectionProvider.getConnection()) {
            store.ingest(conn, record, clock.instant());
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to obtain connection for dead-letter ingestion", e);
        }
        metrics.incrementDeadLettered();
        logger.log(Level.WARNING, "Dead-lettered record {0} after {1} attempts: {2}",
                new Object[]{job.recordId(), message.attempts(), reason});
    }
}
