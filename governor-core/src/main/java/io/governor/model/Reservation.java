package io.governor.model;

/**
 * Outcome of a single atomic reservation against the daily budget.
 *
 * @param reserved     whether the increment was permitted
 * @param requestCount the day's counter after the statement; {@code -1} when the
 *                     store did not report it
 */
public record Reservation(boolean reserved, int requestCount) {

    public static Reservation granted(int requestCount) {
        return new Reservation(true, requestCount);
    }

    public static Reservation denied(int requestCount) {
        return new Reservation(false, requestCount);
    }
}
