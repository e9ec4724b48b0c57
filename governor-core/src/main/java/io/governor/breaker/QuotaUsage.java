package io.governor.breaker;

/**
 * Usage of one budget window.
 *
 * @param used      reservations recorded so far
 * @param limit     configured ceiling
 * @param remaining {@code max(0, limit - used)}
 */
public record QuotaUsage(int used, int limit, int remaining) {

    public static QuotaUsage of(int used, int limit) {
        return new QuotaUsage(used, limit, Math.max(0, limit - used));
    }

    public boolean exhausted() {
        return used >= limit;
    }
}
