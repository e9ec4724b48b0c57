package io.governor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored dead letter: a job that exhausted its queue retry budget.
 *
 * @param id             durable surrogate key
 * @param messageId      id of the queue message that failed
 * @param recordId       catalog record id
 * @param name           record name at failure time
 * @param brewer         failure source attribution, may be {@code null}
 * @param failureReason  last failure message
 * @param failedAt       last time the message was dead-lettered
 * @param failureCount   delivery attempts before dead-lettering
 * @param sourceQueue    queue the message came from
 * @param status         current state
 * @param replayCount    number of successful replays
 * @param replayedAt     last successful replay, or {@code null}
 * @param acknowledgedAt acknowledge time, or {@code null}
 * @param rawMessage     original payload; {@code null} when omitted from a listing
 */
public record DeadLetterEntry(
        long id,
        String messageId,
        String recordId,
        String name,
        String brewer,
        String failureReason,
        Instant failedAt,
        int failureCount,
        String sourceQueue,
        DeadLetterStatus status,
        int replayCount,
        Instant replayedAt,
        Instant acknowledgedAt,
        String rawMessage) {

    public DeadLetterEntry {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(failedAt, "failedAt");
        Objects.requireNonNull(status, "status");
    }

    public DeadLetterEntry withoutRawMessage() {
        if (rawMessage == null) {
            return this;
        }
        return new DeadLetterEntry(id, messageId, recordId, name, brewer, failureReason,
                failedAt, failureCount, sourceQueue, status, replayCount, replayedAt,
                acknowledgedAt, null);
    }
}
