package io.governor.queue;

import io.governor.model.EnrichmentJob;

import java.time.Duration;

/**
 * A delivered job. Exactly one of {@link #ack()} or a {@code retry} variant must be
 * called per delivery.
 */
public interface QueueMessage {

    String id();

    EnrichmentJob job();

    /** Delivery attempts so far, starting at one. */
    int attempts();

    void ack();

    /** Redeliver after the queue's default delay. */
    void retry();

    void retry(Duration delay);
}
