package io.governor.schedule;

import io.governor.breaker.QuotaStatus;
import io.governor.breaker.SkipReason;

/**
 * Outcome of one sweep.
 *
 * @param skipReason     why nothing was enqueued, {@code null} if jobs were queued
 * @param requested      batch size asked for
 * @param effectiveBatch {@code min(requested, dailyRemaining, monthlyRemaining, queue max)},
 *                       zero when the breaker tripped
 * @param queued         jobs enqueued
 * @param blocked        records marked {@code skipped} by the blocklist
 * @param excludeFailures whether records with a pending dead letter were excluded
 * @param quota          the breaker's view at the start of the sweep
 */
public record SweepReport(
        SkipReason skipReason,
        int requested,
        int effectiveBatch,
        int queued,
        int blocked,
        boolean excludeFailures,
        QuotaStatus quota) {

    public boolean skipped() {
        return skipReason != null;
    }

    /** Daily budget left after the jobs queued by this sweep are consumed. */
    public int dailyRemaining() {
        return Math.max(0, quota.dailyRemaining() - queued);
    }

    public int monthlyRemaining() {
        return Math.max(0, quota.monthlyRemaining() - queued);
    }
}
