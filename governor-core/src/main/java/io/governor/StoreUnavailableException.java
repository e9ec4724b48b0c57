package io.governor;

/**
 * A durable store could not be reached or a store statement failed.
 *
 * <p>Treated as a transient infrastructure fault: the circuit breaker fails
 * closed, the consumer retries the batch, and admin operations report
 * {@code STORE_UNAVAILABLE}.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
