package io.governor.spi;

import io.governor.model.EnrichmentJob;

import java.util.OptionalDouble;

/**
 * The external lookup service that derives the attribute for a record.
 *
 * <p>Implementations should throw {@link io.governor.EnrichmentApiException} for
 * error statuses. Any other runtime exception is treated as a retryable failure.
 */
public interface EnrichmentClient {

    /**
     * @return the derived value, or empty when the service has no answer
     */
    OptionalDouble lookup(EnrichmentJob job);

    /** Stored in the catalog's {@code source} column alongside a derived value. */
    String sourceName();
}
