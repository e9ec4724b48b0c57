package io.governor.breaker;

/**
 * Result of running the breaker.
 *
 * <p>{@code daily} and {@code monthly} are {@code null} when the ledger was not
 * read, i.e. for {@link SkipReason#KILL_SWITCH} and
 * {@link SkipReason#STORE_UNAVAILABLE}. {@code daily} is also {@code null} for
 * batch-level checks, which stop after the monthly layer.
 */
public record QuotaStatus(boolean canProcess, SkipReason skipReason, QuotaUsage daily, QuotaUsage monthly) {

    static QuotaStatus allowed(QuotaUsage daily, QuotaUsage monthly) {
        return new QuotaStatus(true, null, daily, monthly);
    }

    static QuotaStatus skipped(SkipReason reason, QuotaUsage daily, QuotaUsage monthly) {
        return new QuotaStatus(false, reason, daily, monthly);
    }

    public int dailyRemaining() {
        return daily == null ? 0 : daily.remaining();
    }

    public int monthlyRemaining() {
        return monthly == null ? 0 : monthly.remaining();
    }
}
