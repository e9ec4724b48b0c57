package io.governor.breaker;

/**
 * Why a sweep or a consumed batch did no work. Budget exhaustion is a normal
 * outcome, not an error.
 */
public enum SkipReason {
    KILL_SWITCH("kill_switch"),
    MONTHLY_LIMIT("monthly_limit"),
    DAILY_LIMIT("daily_limit"),
    NO_ELIGIBLE_RECORDS("no_eligible_records"),
    /** The ledger could not be read; the breaker fails closed. */
    STORE_UNAVAILABLE("store_unavailable");

    private final String code;

    SkipReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
