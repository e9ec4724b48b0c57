package io.governor.queue;

/**
 * Receives messages whose delivery count reached the queue's ceiling.
 */
@FunctionalInterface
public interface DeadLetterSink {

    void accept(QueueMessage message, String reason);
}
