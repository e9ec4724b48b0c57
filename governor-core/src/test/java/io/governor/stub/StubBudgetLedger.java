package io.governor.stub;

import io.governor.StoreUnavailableException;
import io.governor.model.Reservation;
import io.governor.spi.BudgetLedger;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/** In-memory ledger keyed by day. Can be switched into a failing mode. */
public final class StubBudgetLedger implements BudgetLedger {
    private final TreeMap<String, Integer> counts = new TreeMap<>();
    private volatile boolean failing;

    public synchronized void put(String periodKey, int count) {
        counts.put(periodKey, count);
    }

    public synchronized Map<String, Integer> snapshot() {
        return Map.copyOf(counts);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public synchronized Reservation reserve(Connection conn, String periodKey, int dailyLimit, Instant now) {
        checkAvailable();
        int current = counts.getOrDefault(periodKey, 0);
        if (current >= dailyLimit) {
            return Reservation.denied(current);
        }
        counts.put(periodKey, current + 1);
        return Reservation.granted(current + 1);
    }

    @Override
    public synchronized int usedOn(Connection conn, String periodKey) {
        checkAvailable();
        return counts.getOrDefault(periodKey, 0);
    }

    @Override
    public synchronized int usedBetween(Connection conn, String fromKey, String toKey) {
        checkAvailable();
        return counts.subMap(fromKey, true, toKey, true).values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public synchronized int purgeBefore(Connection conn, String periodKey, int limit) {
        checkAvailable();
        int deleted = 0;
        while (deleted < limit && !counts.isEmpty() && counts.firstKey().compareTo(periodKey) < 0) {
            counts.pollFirstEntry();
            deleted++;
        }
        return deleted;
    }

    private void checkAvailable() {
        if (failing) {
            throw new StoreUnavailableException("ledger down", null);
        }
    }
}
