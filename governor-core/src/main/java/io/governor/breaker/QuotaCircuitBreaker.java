package io.governor.breaker;

import io.governor.StoreUnavailableException;
import io.governor.config.GovernorConfig;
import io.governor.model.Reservation;
import io.governor.spi.BudgetLedger;
import io.governor.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three ordered budget checks, each short-circuiting the rest:
 * <ol>
 *   <li>the kill switch, with no ledger read;</li>
 *   <li>the monthly ceiling, a read-only sum over the month's ledger rows;</li>
 *   <li>the daily limit, enforced by {@link #reserve atomic reservation}.</li>
 * </ol>
 *
 * <p>The monthly check is a coarse gate: concurrent evaluators may each pass it
 * and overshoot the month by a few requests. The daily reservation is the hard
 * limit. A ledger that cannot be read is treated as over budget.
 */
public final class QuotaCircuitBreaker {
    private static final Logger logger = Logger.getLogger(QuotaCircuitBreaker.class.getName());

    private final ConnectionProvider connectionProvider;
    private final BudgetLedger ledger;
    private final Clock clock;

    public QuotaCircuitBreaker(ConnectionProvider connectionProvider, BudgetLedger ledger) {
        this(connectionProvider, ledger, Clock.systemUTC());
    }

    public QuotaCircuitBreaker(ConnectionProvider connectionProvider, BudgetLedger ledger, Clock clock) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs the kill switch and monthly layers, then reads the day's usage so the
     * caller can size its work. Never throws for store faults.
     */
    public QuotaStatus evaluate(GovernorConfig config) {
        if (config.killSwitch()) {
            return QuotaStatus.skipped(SkipReason.KILL_SWITCH, null, null);
        }
        Instant now = clock.instant();
        int monthlyUsed;
        int dailyUsed;
        try (Connection conn = connectionProvider.getConnection()) {
            monthlyUsed = ledger.usedBetween(conn,
                    BudgetPeriods.monthStartKey(now), BudgetPeriods.monthEndKey(now));
            dailyUsed = ledger.usedOn(conn, BudgetPeriods.dayKey(now));
        } catch (SQLException | StoreUnavailableException e) {
            logger.log(Level.SEVERE, "Budget ledger unavailable, failing closed", e);
            return QuotaStatus.skipped(SkipReason.STORE_UNAVAILABLE, null, null);
        }
        QuotaUsage monthly = QuotaUsage.of(monthlyUsed, config.monthlyLimit());
        QuotaUsage daily = QuotaUsage.of(dailyUsed, config.dailyLimit());
        if (monthly.exhausted()) {
            return QuotaStatus.skipped(SkipReason.MONTHLY_LIMIT, daily, monthly);
        }
        if (daily.exhausted()) {
            return QuotaStatus.skipped(SkipReason.DAILY_LIMIT, daily, monthly);
        }
        return QuotaStatus.allowed(daily, monthly);
    }

    /**
     * Batch-level check used once per consumed batch: kill switch and monthly
     * ceiling only. The daily layer is left to per-message reservation.
     *
     * <p>Returns {@link SkipReason#STORE_UNAVAILABLE} rather than throwing when the
     * ledger cannot be read, so the caller can choose to retry instead of drop.
     */
    public QuotaStatus checkBatch(GovernorConfig config) {
        if (config.killSwitch()) {
            return QuotaStatus.skipped(SkipReason.KILL_SWITCH, null, null);
        }
        Instant now = clock.instant();
        int monthlyUsed;
        try (Connection conn = connectionProvider.getConnection()) {
            monthlyUsed = ledger.usedBetween(conn,
                    BudgetPeriods.monthStartKey(now), BudgetPeriods.monthEndKey(now));
        } catch (SQLException | StoreUnavailableException e) {
            logger.log(Level.WARNING, "Budget ledger unavailable for batch check", e);
            return QuotaStatus.skipped(SkipReason.STORE_UNAVAILABLE, null, null);
        }
        QuotaUsage monthly = QuotaUsage.of(monthlyUsed, config.monthlyLimit());
        if (monthly.exhausted()) {
            return QuotaStatus.skipped(SkipReason.MONTHLY_LIMIT, null, monthly);
        }
        return QuotaStatus.allowed(null, monthly);
    }

    /**
     * Reserves one request against today's budget.
     *
     * @throws StoreUnavailableException if the ledger cannot be reached
     */
    public Reservation reserve(GovernorConfig config) {
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            return ledger.reserve(conn, BudgetPeriods.dayKey(now), config.dailyLimit(), now);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to obtain connection for reservation", e);
        }
    }
}
