package io.governor.queue;

import io.governor.consumer.BatchOutcome;
import io.governor.consumer.EnrichmentConsumer;
import io.governor.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains an {@link InMemoryJobQueue} into an {@link EnrichmentConsumer} on a
 * single daemon thread, one batch per cycle.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class QueueWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(QueueWorker.class.getName());

    private final InMemoryJobQueue queue;
    private final EnrichmentConsumer consumer;
    private final int batchSize;
    private final long intervalMs;

    private ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private QueueWorker(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.consumer = Objects.requireNonNull(builder.consumer, "consumer");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("QueueWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("governor-queue-"));
        pollTask = executor.scheduleWithFixedDelay(this::runOnce, 0L, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Receives and processes one batch.
     *
     * @return messages processed, zero if the queue had nothing ready
     */
    public int runOnce() {
        if (closed) {
            return 0;
        }
        try {
            List<QueueMessage> batch = queue.receive(batchSize);
            if (batch.isEmpty()) {
                return 0;
            }
            BatchOutcome outcome = consumer.handleBatch(batch);
            logger.log(Level.FINE, "Processed batch: {0}", outcome);
            return batch.size();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Queue worker cycle failed", t);
            return 0;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link QueueWorker}. */
    public static final class Builder {
        private InMemoryJobQueue queue;
        private EnrichmentConsumer consumer;
        private int batchSize = 10;
        private long intervalMs = 1000L;

        private Builder() {}

        public Builder queue(InMemoryJobQueue queue) {
            this.queue = queue;
            return this;
        }

        public Builder consumer(EnrichmentConsumer consumer) {
            this.consumer = consumer;
            return this;
        }

        /** Optional. Messages per consumed batch. Defaults to {@code 10}. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Optional. Delay between cycles. Defaults to {@code 1000} ms. */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        public QueueWorker build() {
            return new QueueWorker(this);
        }
    }
}
