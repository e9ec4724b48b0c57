package io.governor.spi;

import io.governor.breaker.SkipReason;

/**
 * Telemetry sink for governor outcomes. All methods default to no-ops.
 *
 * @see #NOOP
 */
public interface GovernorMetrics {

    GovernorMetrics NOOP = new GovernorMetrics() {};

    /** A sweep or a consumed batch stopped early for {@code reason}. */
    default void incrementSkipped(SkipReason reason) {}

    /** A sweep enqueued {@code queued} jobs and marked {@code blocked} records skipped. */
    default void recordSweep(int queued, int blocked) {}

    default void recordRemainingBudget(int dailyRemaining, int monthlyRemaining) {}

    default void incrementEnriched() {}

    default void incrementNotFound() {}

    default void incrementOverBudget() {}

    default void incrementLookupFailure(boolean rateLimited) {}

    default void recordReplay(int replayed, int failed) {}

    default void recordAcknowledged(int acknowledged) {}

    default void incrementDeadLettered() {}

    /** Rows removed by retention cleanup; {@code target} is {@code ledger}, {@code replayed} or {@code acknowledged}. */
    default void recordCleanup(String target, int deleted) {}
}
