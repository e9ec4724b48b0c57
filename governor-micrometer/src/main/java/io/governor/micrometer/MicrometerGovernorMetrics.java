package io.governor.micrometer;

import io.governor.breaker.SkipReason;
import io.governor.model.DeadLetterStatus;
import io.governor.spi.GovernorMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link GovernorMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code enrichment.skipped} tagged {@code reason}: sweeps and batches stopped by the breaker</li>
 *   <li>{@code enrichment.sweep.queued}: jobs enqueued by sweeps</li>
 *   <li>{@code enrichment.sweep.blocked}: records marked skipped by the blocklist</li>
 *   <li>{@code enrichment.lookup.enriched}: lookups that returned a value</li>
 *   <li>{@code enrichment.lookup.not_found}: lookups with no answer</li>
 *   <li>{@code enrichment.lookup.over_budget}: messages acked because the daily reservation was refused</li>
 *   <li>{@code enrichment.lookup.failure} tagged {@code type} ({@code rate_limited} or {@code error})</li>
 *   <li>{@code enrichment.dead_letter.ingested}, {@code .replayed}, {@code .replay_failed}, {@code .acknowledged}</li>
 *   <li>{@code enrichment.cleanup.deleted} tagged {@code target} ({@code ledger}, {@code acknowledged}, {@code replayed})</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code enrichment.budget.daily.remaining}: as of the last sweep</li>
 *   <li>{@code enrichment.budget.monthly.remaining}: as of the last sweep</li>
 * </ul>
 *
 * @see GovernorMetrics
 */
public final class MicrometerGovernorMetrics implements GovernorMetrics, AutoCloseable {

    static final String LEDGER_TARGET = "ledger";

    private final MeterRegistry registry;
    private final Map<SkipReason, Counter> skipped = new EnumMap<>(SkipReason.class);
    private final Counter sweepQueued;
    private final Counter sweepBlocked;
    private final Counter enriched;
    private final Counter notFound;
    private final Counter overBudget;
    private final Counter rateLimited;
    private final Counter lookupError;
    private final Counter deadLettered;
    private final Counter replayed;
    private final Counter replayFailed;
    private final Counter acknowledged;
    private final Counter ledgerDeleted;
    private final Counter acknowledgedDeleted;
    private final Counter replayedDeleted;
    private final Gauge dailyRemainingGauge;
    private final Gauge monthlyRemainingGauge;

    private final AtomicInteger dailyRemaining = new AtomicInteger();
    private final AtomicInteger monthlyRemaining = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates metrics with the default name prefix {@code "enrichment"}.
     */
    public MicrometerGovernorMetrics(MeterRegistry registry) {
        this(registry, "enrichment");
    }

    /**
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names, without a trailing dot
     */
    public MicrometerGovernorMetrics(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        for (SkipReason reason : SkipReason.values()) {
            skipped.put(reason, Counter.builder(namePrefix + ".skipped")
                    .tag("reason", reason.code())
                    .description("Sweeps and batches stopped before doing work")
                    .register(registry));
        }
        this.sweepQueued = Counter.builder(namePrefix + ".sweep.queued")
                .description("Jobs enqueued by sweeps")
                .register(registry);
        this.sweepBlocked = Counter.builder(namePrefix + ".sweep.blocked")
                .description("Records marked skipped by the blocklist")
                .register(registry);
        this.enriched = Counter.builder(namePrefix + ".lookup.enriched")
                .description("Lookups that returned a value")
                .register(registry);
        this.notFound = Counter.builder(namePrefix + ".lookup.not_found")
                .description("Lookups that returned no answer")
                .register(registry);
        this.overBudget = Counter.builder(namePrefix + ".lookup.over_budget")
                .description("Messages dropped because the daily budget was spent")
                .register(registry);
        this.rateLimited = Counter.builder(namePrefix + ".lookup.failure")
                .tag("type", "rate_limited")
                .description("Failed lookups")
                .register(registry);
        this.lookupError = Counter.builder(namePrefix + ".lookup.failure")
                .tag("type", "error")
                .description("Failed lookups")
                .register(registry);
        this.deadLettered = Counter.builder(namePrefix + ".dead_letter.ingested")
                .description("Messages stored as dead letters")
                .register(registry);
        this.replayed = Counter.builder(namePrefix + ".dead_letter.replayed")
                .description("Dead letters re-enqueued")
                .register(registry);
        this.replayFailed = Counter.builder(namePrefix + ".dead_letter.replay_failed")
                .description("Claimed dead letters returned to pending")
                .register(registry);
        this.acknowledged = Counter.builder(namePrefix + ".dead_letter.acknowledged")
                .description("Dead letters dismissed by an operator")
                .register(registry);
        this.ledgerDeleted = cleanupCounter(namePrefix, LEDGER_TARGET);
        this.acknowledgedDeleted = cleanupCounter(namePrefix, DeadLetterStatus.ACKNOWLEDGED.code());
        this.replayedDeleted = cleanupCounter(namePrefix, DeadLetterStatus.REPLAYED.code());

        this.dailyRemainingGauge = Gauge.builder(namePrefix + ".budget.daily.remaining",
                        dailyRemaining, AtomicInteger::get)
                .register(registry);
        this.monthlyRemainingGauge = Gauge.builder(namePrefix + ".budget.monthly.remaining",
                        monthlyRemaining, AtomicInteger::get)
                .register(registry);
    }

    private Counter cleanupCounter(String namePrefix, String target) {
        return Counter.builder(namePrefix + ".cleanup.deleted")
                .tag("target", target)
                .description("Rows removed by retention cleanup")
                .register(registry);
    }

    @Override
    public void incrementSkipped(SkipReason reason) {
        if (closed) return;
        skipped.get(reason).increment();
    }

    @Override
    public void recordSweep(int queued, int blocked) {
        if (closed) return;
        sweepQueued.increment(queued);
        sweepBlocked.increment(blocked);
    }

    @Override
    public void recordRemainingBudget(int dailyRemaining, int monthlyRemaining) {
        if (closed) return;
        this.dailyRemaining.set(dailyRemaining);
        this.monthlyRemaining.set(monthlyRemaining);
    }

    @Override
    public void incrementEnriched() {
        if (closed) return;
        enriched.increment();
    }

    @Override
    public void incrementNotFound() {
        if (closed) return;
        notFound.increment();
    }

    @Override
    public void incrementOverBudget() {
        if (closed) return;
        overBudget.increment();
    }

    @Override
    public void incrementLookupFailure(boolean rateLimited) {
        if (closed) return;
        (rateLimited ? this.rateLimited : lookupError).increment();
    }

    @Override
    public void recordReplay(int replayed, int failed) {
        if (closed) return;
        this.replayed.increment(replayed);
        replayFailed.increment(failed);
    }

    @Override
    public void recordAcknowledged(int acknowledged) {
        if (closed) return;
        this.acknowledged.increment(acknowledged);
    }

    @Override
    public void incrementDeadLettered() {
        if (closed) return;
        deadLettered.increment();
    }

    @Override
    public void recordCleanup(String target, int deleted) {
        if (closed) return;
        Counter counter = switch (target) {
            case LEDGER_TARGET -> ledgerDeleted;
            case "acknowledged" -> acknowledgedDeleted;
            case "replayed" -> replayedDeleted;
            default -> null;
        };
        if (counter != null) {
            counter.increment(deleted);
        }
    }

    /**
     * Removes every meter registered by this instance from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(skipped.values());
        meters.addAll(List.of(sweepQueued, sweepBlocked, enriched, notFound, overBudget,
                rateLimited, lookupError, deadLettered, replayed, replayFailed, acknowledged,
                ledgerDeleted, acknowledgedDeleted, replayedDeleted,
                dailyRemainingGauge, monthlyRemainingGauge));
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
