package io.governor.breaker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BudgetPeriodsTest {

    @Test
    void dayKeyUsesUtcDate() {
        assertEquals("2024-03-31", BudgetPeriods.dayKey(Instant.parse("2024-03-31T23:59:59Z")));
        assertEquals("2024-04-01", BudgetPeriods.dayKey(Instant.parse("2024-04-01T00:00:00Z")));
    }

    @Test
    void monthBoundsCoverLeapFebruary() {
        Instant now = Instant.parse("2024-02-15T12:00:00Z");

        assertEquals("2024-02-01", BudgetPeriods.monthStartKey(now));
        assertEquals("2024-02-29", BudgetPeriods.monthEndKey(now));
    }

    @Test
    void retentionKeyIsDayKeyOfCutoff() {
        Instant now = Instant.parse("2024-04-10T08:00:00Z");

        assertEquals("2024-01-11", BudgetPeriods.retentionKey(now, Duration.ofDays(90)));
    }
}
