package io.governor.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for the governor.
 *
 * <p>Passed explicitly to each component, usually through a
 * {@code Supplier<GovernorConfig>} so a flipped kill switch or a new limit is
 * picked up on the next sweep, batch or admin call without a restart.
 *
 * <p>Create instances via {@link #builder()} or {@link #defaults()}.
 */
public final class GovernorConfig {
    private final boolean killSwitch;
    private final int dailyLimit;
    private final int monthlyLimit;
    private final Duration ledgerRetention;
    private final Duration deadLetterRetention;
    private final Duration interCallDelay;
    private final Duration rateLimitRetryDelay;
    private final Duration defaultRetryDelay;
    private final int maxReplayBatch;
    private final int maxAcknowledgeBatch;
    private final int maxEnqueueBatch;
    private final int cleanupBatchSize;
    private final double confidence;
    private final String sourceQueue;

    private GovernorConfig(Builder builder) {
        if (builder.dailyLimit < 0) {
            throw new IllegalArgumentException("dailyLimit must be >= 0");
        }
        if (builder.monthlyLimit < 0) {
            throw new IllegalArgumentException("monthlyLimit must be >= 0");
        }
        if (builder.maxReplayBatch <= 0) {
            throw new IllegalArgumentException("maxReplayBatch must be > 0");
        }
        if (builder.maxAcknowledgeBatch <= 0) {
            throw new IllegalArgumentException("maxAcknowledgeBatch must be > 0");
        }
        if (builder.maxEnqueueBatch <= 0) {
            throw new IllegalArgumentException("maxEnqueueBatch must be > 0");
        }
        if (builder.cleanupBatchSize <= 0) {
            throw new IllegalArgumentException("cleanupBatchSize must be > 0");
        }
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
        this.killSwitch = builder.killSwitch;
        this.dailyLimit = builder.dailyLimit;
        this.monthlyLimit = builder.monthlyLimit;
        this.ledgerRetention = nonNegative(builder.ledgerRetention, "ledgerRetention");
        this.deadLetterRetention = nonNegative(builder.deadLetterRetention, "deadLetterRetention");
        this.interCallDelay = nonNegative(builder.interCallDelay, "interCallDelay");
        this.rateLimitRetryDelay = nonNegative(builder.rateLimitRetryDelay, "rateLimitRetryDelay");
        this.defaultRetryDelay = nonNegative(builder.defaultRetryDelay, "defaultRetryDelay");
        this.maxReplayBatch = builder.maxReplayBatch;
        this.maxAcknowledgeBatch = builder.maxAcknowledgeBatch;
        this.maxEnqueueBatch = builder.maxEnqueueBatch;
        this.cleanupBatchSize = builder.cleanupBatchSize;
        this.confidence = builder.confidence;
        this.sourceQueue = Objects.requireNonNull(builder.sourceQueue, "sourceQueue");
    }

    private static Duration nonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }

    public static GovernorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .killSwitch(killSwitch)
                .dailyLimit(dailyLimit)
                .monthlyLimit(monthlyLimit)
                .ledgerRetention(ledgerRetention)
                .deadLetterRetention(deadLetterRetention)
                .interCallDelay(interCallDelay)
                .rateLimitRetryDelay(rateLimitRetryDelay)
                .defaultRetryDelay(defaultRetryDelay)
                .maxReplayBatch(maxReplayBatch)
                .maxAcknowledgeBatch(maxAcknowledgeBatch)
                .maxEnqueueBatch(maxEnqueueBatch)
                .cleanupBatchSize(cleanupBatchSize)
                .confidence(confidence)
                .sourceQueue(sourceQueue);
    }

    /** When set, every sweep and every consumed batch is skipped without touching the ledger. */
    public boolean killSwitch() {
        return killSwitch;
    }

    public int dailyLimit() {
        return dailyLimit;
    }

    public int monthlyLimit() {
        return monthlyLimit;
    }

    public Duration ledgerRetention() {
        return ledgerRetention;
    }

    /** Applies to {@code replayed} and {@code acknowledged} dead letters, each by its own timestamp. */
    public Duration deadLetterRetention() {
        return deadLetterRetention;
    }

    public Duration interCallDelay() {
        return interCallDelay;
    }

    public Duration rateLimitRetryDelay() {
        return rateLimitRetryDelay;
    }

    public Duration defaultRetryDelay() {
        return defaultRetryDelay;
    }

    public int maxReplayBatch() {
        return maxReplayBatch;
    }

    public int maxAcknowledgeBatch() {
        return maxAcknowledgeBatch;
    }

    public int maxEnqueueBatch() {
        return maxEnqueueBatch;
    }

    public int cleanupBatchSize() {
        return cleanupBatchSize;
    }

    /** Confidence recorded alongside a value returned by the lookup service. */
    public double confidence() {
        return confidence;
    }

    public String sourceQueue() {
        return sourceQueue;
    }

    @Override
    public String toString() {
        return "GovernorConfig{killSwitch=" + killSwitch +
                ", dailyLimit=" + dailyLimit +
                ", monthlyLimit=" + monthlyLimit +
                ", ledgerRetention=" + ledgerRetention +
                ", deadLetterRetention=" + deadLetterRetention +
                ", interCallDelay=" + interCallDelay +
                ", rateLimitRetryDelay=" + rateLimitRetryDelay +
                ", defaultRetryDelay=" + defaultRetryDelay +
                ", maxReplayBatch=" + maxReplayBatch +
                ", maxAcknowledgeBatch=" + maxAcknowledgeBatch +
                ", maxEnqueueBatch=" + maxEnqueueBatch +
                ", cleanupBatchSize=" + cleanupBatchSize +
                ", confidence=" + confidence +
                ", sourceQueue=" + sourceQueue + '}';
    }

    /** Builder for {@link GovernorConfig}. */
    public static final class Builder {
        private boolean killSwitch;
        private int dailyLimit = 500;
        private int monthlyLimit = 2000;
        private Duration ledgerRetention = Duration.ofDays(90);
        private Duration deadLetterRetention = Duration.ofDays(30);
        private Duration interCallDelay = Duration.ofSeconds(2);
        private Duration rateLimitRetryDelay = Duration.ofSeconds(120);
        private Duration defaultRetryDelay = Duration.ofSeconds(60);
        private int maxReplayBatch = 50;
        private int maxAcknowledgeBatch = 100;
        private int maxEnqueueBatch = 100;
        private int cleanupBatchSize = 1000;
        private double confidence = 0.7;
        private String sourceQueue = "enrichment";

        private Builder() {}

        public Builder killSwitch(boolean killSwitch) {
            this.killSwitch = killSwitch;
            return this;
        }

        /**
         * Maximum reservations per UTC day.
         *
         * <p>Optional. Defaults to {@code 500}. Must be &ge; 0; zero blocks all work.
         */
        public Builder dailyLimit(int dailyLimit) {
            this.dailyLimit = dailyLimit;
            return this;
        }

        /**
         * Soft ceiling on reservations per calendar month, checked before each sweep and batch.
         *
         * <p>Optional. Defaults to {@code 2000}. Must be &ge; 0.
         */
        public Builder monthlyLimit(int monthlyLimit) {
            this.monthlyLimit = monthlyLimit;
            return this;
        }

        public Builder ledgerRetention(Duration ledgerRetention) {
            this.ledgerRetention = ledgerRetention;
            return this;
        }

        public Builder deadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = deadLetterRetention;
            return this;
        }

        public Builder interCallDelay(Duration interCallDelay) {
            this.interCallDelay = interCallDelay;
            return this;
        }

        public Builder rateLimitRetryDelay(Duration rateLimitRetryDelay) {
            this.rateLimitRetryDelay = rateLimitRetryDelay;
            return this;
        }

        public Builder defaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
            return this;
        }

        public Builder maxReplayBatch(int maxReplayBatch) {
            this.maxReplayBatch = maxReplayBatch;
            return this;
        }

        public Builder maxAcknowledgeBatch(int maxAcknowledgeBatch) {
            this.maxAcknowledgeBatch = maxAcknowledgeBatch;
            return this;
        }

        public Builder maxEnqueueBatch(int maxEnqueueBatch) {
            this.maxEnqueueBatch = maxEnqueueBatch;
            return this;
        }

        public Builder cleanupBatchSize(int cleanupBatchSize) {
            this.cleanupBatchSize = cleanupBatchSize;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder sourceQueue(String sourceQueue) {
            this.sourceQueue = sourceQueue;
            return this;
        }

        /**
         * @throws NullPointerException if a duration or {@code sourceQueue} is null
         * @throws IllegalArgumentException if a limit is negative, a batch size is
         *     not positive, a duration is negative, or confidence is outside [0, 1]
         */
        public GovernorConfig build() {
            return new GovernorConfig(this);
        }
    }
}
