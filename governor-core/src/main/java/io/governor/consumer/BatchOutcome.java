package io.governor.consumer;

import io.governor.breaker.SkipReason;

/**
 * What one consumed batch did. Every received message is counted exactly once in
 * {@code acked} or {@code retried}.
 *
 * @param received        messages in the batch
 * @param acked           messages acknowledged
 * @param retried         messages handed back for redelivery
 * @param enriched        lookups that returned a value
 * @param notFound        lookups that returned no answer
 * @param alreadyResolved messages acked because the record was no longer pending
 * @param overBudget      messages acked because the daily reservation was refused
 * @param rateLimited     lookups rejected with a rate-limit status
 * @param failed          other lookup or store failures
 * @param batchSkipReason set when the batch-level check stopped the whole batch
 */
public record BatchOutcome(
        int received,
        int acked,
        int retried,
        int enriched,
        int notFound,
        int alreadyResolved,
        int overBudget,
        int rateLimited,
        int failed,
        SkipReason batchSkipReason) {

    public boolean skipped() {
        return batchSkipReason != null;
    }
}
