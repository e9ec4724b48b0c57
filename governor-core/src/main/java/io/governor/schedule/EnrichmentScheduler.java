package io.governor.schedule;

import io.governor.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic trigger: each cycle runs an {@link EnrichmentSweep} and then a
 * {@link RetentionCleaner}, on one daemon thread.
 *
 * <p>Cleanup runs even when the sweep was skipped. A failing step is logged and
 * never cancels the schedule.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EnrichmentScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EnrichmentScheduler.class.getName());

    private final EnrichmentSweep sweep;
    private final RetentionCleaner cleaner;
    private final long intervalSeconds;
    private final long initialDelaySeconds;

    private ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> cycleTask;
    private volatile boolean closed;

    private EnrichmentScheduler(Builder builder) {
        this.sweep = Objects.requireNonNull(builder.sweep, "sweep");
        this.cleaner = Objects.requireNonNull(builder.cleaner, "cleaner");
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        if (builder.initialDelaySeconds < 0L) {
            throw new IllegalArgumentException("initialDelaySeconds must be >= 0");
        }
        this.intervalSeconds = builder.intervalSeconds;
        this.initialDelaySeconds = builder.initialDelaySeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Starts the schedule. Subsequent calls are no-ops. */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("EnrichmentScheduler has been closed");
        }
        if (cycleTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("governor-sweep-"));
        cycleTask = executor.scheduleWithFixedDelay(
                this::runOnce, initialDelaySeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Runs one sweep and one cleanup. May be invoked directly.
     */
    public void runOnce() {
        if (closed) {
            return;
        }
        try {
            sweep.runOnce();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Sweep failed", t);
        }
        try {
            cleaner.runOnce();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retention cleanup failed", t);
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (cycleTask != null) {
            cycleTask.cancel(false);
            cycleTask = null;
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

    /** Builder for {@link EnrichmentScheduler}. */
    public static final class Builder {
        private EnrichmentSweep sweep;
        private RetentionCleaner cleaner;
        private long intervalSeconds = 3600;
        private long initialDelaySeconds = 60;

        private Builder() {}

        /** <b>Required.</b> */
        public Builder sweep(EnrichmentSweep sweep) {
            this.sweep = sweep;
            return this;
        }

        /** <b>Required.</b> */
        public Builder cleaner(RetentionCleaner cleaner) {
            this.cleaner = cleaner;
            return this;
        }

        /** Optional. Defaults to {@code 3600} (hourly). Must be &gt; 0. */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        /** Optional. Defaults to {@code 60}. */
        public Builder initialDelaySeconds(long initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
            return this;
        }

        public EnrichmentScheduler build() {
            return new EnrichmentScheduler(this);
        }
    }
}
