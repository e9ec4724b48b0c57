package io.governor.breaker;

import io.governor.StoreUnavailableException;
import io.governor.config.GovernorConfig;
import io.governor.model.Reservation;
import io.governor.stub.MutableClock;
import io.governor.stub.StubBudgetLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuotaCircuitBreakerTest {

    private static final Instant NOW = Instant.parse("2024-05-20T10:00:00Z");

    private StubBudgetLedger ledger;
    private QuotaCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        ledger = new StubBudgetLedger();
        breaker = new QuotaCircuitBreaker(() -> null, ledger, new MutableClock(NOW));
    }

    @Test
    void killSwitchWinsWithoutReadingLedger() {
        ledger.setFailing(true);

        QuotaStatus status = breaker.evaluate(GovernorConfig.builder().killSwitch(true).build());

        assertFalse(status.canProcess());
        assertEquals(SkipReason.KILL_SWITCH, status.skipReason());
        assertNull(status.daily());
        assertNull(status.monthly());
    }

    @Test
    void monthlyLimitCheckedBeforeDaily() {
        ledger.put("2024-05-01", 10);
        ledger.put("2024-05-20", 5);

        QuotaStatus status = breaker.evaluate(config(5, 15));

        assertEquals(SkipReason.MONTHLY_LIMIT, status.skipReason());
        assertEquals(15, status.monthly().used());
        assertEquals(0, status.monthlyRemaining());
    }

    @Test
    void previousMonthDoesNotCount() {
        ledger.put("2024-04-30", 100);
        ledger.put("2024-05-20", 2);

        QuotaStatus status = breaker.evaluate(config(5, 10));

        assertTrue(status.canProcess());
        assertEquals(3, status.dailyRemaining());
        assertEquals(8, status.monthlyRemaining());
    }

    @Test
    void dailyLimitTrips() {
        ledger.put("2024-05-20", 5);

        QuotaStatus status = breaker.evaluate(config(5, 100));

        assertEquals(SkipReason.DAILY_LIMIT, status.skipReason());
        assertEquals(0, status.dailyRemaining());
    }

    @Test
    void zeroLimitsBlockImmediately() {
        assertEquals(SkipReason.MONTHLY_LIMIT, breaker.evaluate(config(5, 0)).skipReason());
        assertEquals(SkipReason.DAILY_LIMIT, breaker.evaluate(config(0, 5)).skipReason());
    }

    @Test
    void unreadableLedgerFailsClosed() {
        ledger.setFailing(true);

        QuotaStatus status = breaker.evaluate(config(5, 10));

        assertFalse(status.canProcess());
        assertEquals(SkipReason.STORE_UNAVAILABLE, status.skipReason());
        assertEquals(0, status.dailyRemaining());
    }

    @Test
    void connectionFailureFailsClosed() {
        QuotaCircuitBreaker broken = new QuotaCircuitBreaker(() -> {
            throw new SQLException("no connection");
        }, ledger, new MutableClock(NOW));

        assertEquals(SkipReason.STORE_UNAVAILABLE, broken.evaluate(config(5, 10)).skipReason());
        assertEquals(SkipReason.STORE_UNAVAILABLE, broken.checkBatch(config(5, 10)).skipReason());
        assertThrows(StoreUnavailableException.class, () -> broken.reserve(config(5, 10)));
    }

    @Test
    void batchCheckIgnoresDailyUsage() {
        ledger.put("2024-05-20", 5);

        QuotaStatus status = breaker.checkBatch(config(5, 100));

        assertTrue(status.canProcess());
        assertNull(status.daily());
        assertEquals(95, status.monthlyRemaining());
    }

    @Test
    void batchCheckHonoursKillSwitchAndMonthlyCeiling() {
        ledger.put("2024-05-02", 100);

        assertEquals(SkipReason.MONTHLY_LIMIT, breaker.checkBatch(config(5, 100)).skipReason());
        assertEquals(SkipReason.KILL_SWITCH,
                breaker.checkBatch(config(5, 100).toBuilder().killSwitch(true).build()).skipReason());
    }

    @Test
    void reserveUsesTodaysKey() {
        Reservation first = breaker.reserve(config(2, 100));
        Reservation second = breaker.reserve(config(2, 100));
        Reservation third = breaker.reserve(config(2, 100));

        assertTrue(first.reserved());
        assertTrue(second.reserved());
        assertFalse(third.reserved());
        assertEquals(2, ledger.snapshot().get("2024-05-20"));
    }

    private static GovernorConfig config(int daily, int monthly) {
        return GovernorConfig.builder().dailyLimit(daily).monthlyLimit(monthly).build();
    }
}
