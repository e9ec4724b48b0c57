package io.governor.model;

import java.util.Objects;

/**
 * Input to dead-letter ingestion. Upserted by {@code messageId}.
 */
public record DeadLetterRecord(
        String messageId,
        String recordId,
        String name,
        String brewer,
        String failureReason,
        int failureCount,
        String sourceQueue,
        String rawMessage) {

    public DeadLetterRecord {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(sourceQueue, "sourceQueue");
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must be >= 0");
        }
    }
}
