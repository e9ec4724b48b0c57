package io.governor.schedule;

/**
 * Rows removed by one retention cleanup run.
 */
public record CleanupReport(long ledgerDeleted, long acknowledgedDeleted, long replayedDeleted) {

    public long total() {
        return ledgerDeleted + acknowledgedDeleted + replayedDeleted;
    }
}
