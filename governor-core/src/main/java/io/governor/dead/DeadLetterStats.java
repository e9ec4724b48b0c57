package io.governor.dead;

import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterStatus;
import io.governor.model.SourceCount;

import java.util.List;
import java.util.Map;

/**
 * Read-only aggregate view of the dead-letter store.
 *
 * @param byStatus              row count per status
 * @param oldestPendingAgeHours age of the oldest pending row in hours, one decimal;
 *                              {@code null} when nothing is pending
 * @param topFailingSources     sources with the most pending rows
 * @param repeatFailures        pending rows that were replayed before and failed again
 * @param last24h               transitions in the last 24 hours
 */
public record DeadLetterStats(
        Map<DeadLetterStatus, Integer> byStatus,
        Double oldestPendingAgeHours,
        List<SourceCount> topFailingSources,
        List<DeadLetterEntry> repeatFailures,
        Last24h last24h) {

    public record Last24h(int replayed, int acknowledged, int newFailures) {
    }
}
