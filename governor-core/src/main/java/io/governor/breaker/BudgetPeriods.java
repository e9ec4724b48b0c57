package io.governor.breaker;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Ledger period keys. Days are UTC dates formatted {@code yyyy-MM-dd}.
 */
public final class BudgetPeriods {
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private BudgetPeriods() {}

    public static String dayKey(Instant instant) {
        return DAY.format(LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    public static String monthStartKey(Instant instant) {
        return DAY.format(YearMonth.from(LocalDate.ofInstant(instant, ZoneOffset.UTC)).atDay(1));
    }

    public static String monthEndKey(Instant instant) {
        return DAY.format(YearMonth.from(LocalDate.ofInstant(instant, ZoneOffset.UTC)).atEndOfMonth());
    }

    /** Oldest day key still retained: rows with smaller keys may be deleted. */
    public static String retentionKey(Instant now, Duration retention) {
        return dayKey(now.minus(retention));
    }
}
