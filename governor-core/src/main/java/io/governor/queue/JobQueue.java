package io.governor.queue;

import io.governor.model.EnrichmentJob;

import java.time.Duration;
import java.util.List;

/**
 * Enqueue side of the job queue, shared by the sweep and dead-letter replay.
 *
 * <p>Implementations throw {@link QueueException} when a send is rejected.
 */
public interface JobQueue {

    default void send(EnrichmentJob job) {
        send(job, Duration.ZERO);
    }

    void send(EnrichmentJob job, Duration delay);

    /**
     * Sends a replayed job under the id of the message it was dead-lettered from,
     * so a repeat failure updates the same dead-letter row. Queues that assign
     * their own message ids send it as a new message.
     */
    default void resend(String messageId, EnrichmentJob job, Duration delay) {
        send(job, delay);
    }

    /**
     * Sends up to {@link #maxBatchSize()} jobs in one call.
     *
     * @throws IllegalArgumentException if {@code jobs} exceeds the maximum batch size
     */
    void sendBatch(List<EnrichmentJob> jobs);

    int maxBatchSize();
}
