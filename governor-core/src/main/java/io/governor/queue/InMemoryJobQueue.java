package io.governor.queue;

import io.governor.model.EnrichmentJob;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-process job queue with delayed delivery and a delivery-count ceiling.
 *
 * <p>A message retried after its last permitted delivery is handed to the
 * configured {@link DeadLetterSink} instead of being redelivered. If the sink
 * fails, the message is kept and retried again after the default delay.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class InMemoryJobQueue implements JobQueue {
    private static final Logger logger = Logger.getLogger(InMemoryJobQueue.class.getName());

    private final int maxBatchSize;
    private final int maxDeliveries;
    private final Duration defaultRetryDelay;
    private final DeadLetterSink deadLetterSink;
    private final Clock clock;

    private final PriorityQueue<Entry> ready = new PriorityQueue<>(
            Comparator.comparing(Entry::visibleAt).thenComparingLong(Entry::sequence));
    private long sequence;
    private int inFlight;

    private InMemoryJobQueue(Builder builder) {
        if (builder.maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be > 0");
        }
        if (builder.maxDeliveries <= 0) {
            throw new IllegalArgumentException("maxDeliveries must be > 0");
        }
        Objects.requireNonNull(builder.defaultRetryDelay, "defaultRetryDelay");
        if (builder.defaultRetryDelay.isNegative()) {
            throw new IllegalArgumentException("defaultRetryDelay must be >= 0");
        }
        this.maxBatchSize = builder.maxBatchSize;
        this.maxDeliveries = builder.maxDeliveries;
        this.defaultRetryDelay = builder.defaultRetryDelay;
        this.deadLetterSink = builder.deadLetterSink;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void send(EnrichmentJob job, Duration delay) {
        Objects.requireNonNull(job, "job");
        Duration d = delay != null ? delay : Duration.ZERO;
        if (d.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        enqueue(UUID.randomUUID().toString(), job, 0, clock.instant().plus(d));
    }

    @Override
    public void resend(String messageId, EnrichmentJob job, Duration delay) {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(job, "job");
        Duration d = delay != null ? delay : Duration.ZERO;
        if (d.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        enqueue(messageId, job, 0, clock.instant().plus(d));
    }

    @Override
    public void sendBatch(List<EnrichmentJob> jobs) {
        if (jobs.size() > maxBatchSize) {
            throw new IllegalArgumentException("batch of " + jobs.size() +
                    " exceeds maxBatchSize " + maxBatchSize);
        }
        Instant now = clock.instant();
        synchronized (this) {
            for (EnrichmentJob job : jobs) {
                enqueue(UUID.randomUUID().toString(), Objects.requireNonNull(job, "job"), 0, now);
            }
        }
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Delivers up to {@code max} messages whose delay has elapsed, oldest first.
     * Each returned message must be acked or retried.
     */
    public synchronized List<QueueMessage> receive(int max) {
        Instant now = clock.instant();
        List<QueueMessage> batch = new ArrayList<>();
        while (batch.size() < max && !ready.isEmpty() && !ready.peek().visibleAt().isAfter(now)) {
            Entry entry = ready.poll();
            batch.add(new Delivery(entry.id(), entry.job(), entry.attempts() + 1));
            inFlight++;
        }
        return batch;
    }

    /** Messages waiting for delivery, including delayed ones. */
    public synchronized int size() {
        return ready.size();
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    private synchronized void enqueue(String id, EnrichmentJob job, int attempts, Instant visibleAt) {
        ready.add(new Entry(id, job, attempts, visibleAt, sequence++));
    }

    private synchronized void settle() {
        inFlight--;
    }

    private record Entry(String id, EnrichmentJob job, int attempts, Instant visibleAt, long sequence) {
    }

    private final class Delivery implements QueueMessage {
        private final String id;
        private final EnrichmentJob job;
        private final int attempts;
        private final AtomicBoolean settled = new AtomicBoolean();

        Delivery(String id, EnrichmentJob job, int attempts) {
            this.id = id;
            this.job = job;
            this.attempts = attempts;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public EnrichmentJob job() {
            return job;
        }

        @Override
        public int attempts() {
            return attempts;
        }

        @Override
        public void ack() {
            markSettled();
        }

        @Override
        public void retry() {
            retry(defaultRetryDelay);
        }

        @Override
        public void retry(Duration delay) {
            markSettled();
            if (attempts >= maxDeliveries) {
                deadLetter();
                return;
            }
            Duration d = delay != null && !delay.isNegative() ? delay : defaultRetryDelay;
            enqueue(id, job, attempts, clock.instant().plus(d));
        }

        private void deadLetter() {
            String reason = "Exceeded " + maxDeliveries + " delivery attempts";
            if (deadLetterSink == null) {
                logger.log(Level.WARNING, "Dropping message {0} for record {1}: {2}",
                        new Object[]{id, job.recordId(), reason});
                return;
            }
            try {
                deadLetterSink.accept(this, reason);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Dead-letter ingestion failed for message " + id +
                        ", keeping it queued", e);
                enqueue(id, job, attempts, clock.instant().plus(defaultRetryDelay));
            }
        }

        private void markSettled() {
            if (!settled.compareAndSet(false, true)) {
                throw new IllegalStateException("Message " + id + " was already acked or retried");
            }
            settle();
        }
    }

    /** Builder for {@link InMemoryJobQueue}. */
    public static final class Builder {
        private int maxBatchSize = 100;
        private int maxDeliveries = 3;
        private Duration defaultRetryDelay = Duration.ofSeconds(60);
        private DeadLetterSink deadLetterSink;
        private Clock clock;

        private Builder() {}

        /** Optional. Defaults to {@code 100}. */
        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        /** Optional. Defaults to {@code 3}; the last failed delivery is dead-lettered. */
        public Builder maxDeliveries(int maxDeliveries) {
            this.maxDeliveries = maxDeliveries;
            return this;
        }

        /** Optional. Delay applied by {@link QueueMessage#retry()}. Defaults to 60 seconds. */
        public Builder defaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
            return this;
        }

        /** Optional. Without a sink, exhausted messages are logged and dropped. */
        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public InMemoryJobQueue build() {
            return new InMemoryJobQueue(this);
        }
    }
}
