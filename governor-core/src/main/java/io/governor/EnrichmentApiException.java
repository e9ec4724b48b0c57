package io.governor;

/**
 * Thrown by an {@link io.governor.spi.EnrichmentClient} when the lookup service
 * answers with an error status.
 *
 * <p>Status {@code 429} is treated as rate limiting and retried with the extended
 * delay; every other status is retried with the default delay.
 */
public class EnrichmentApiException extends RuntimeException {
    public static final int TOO_MANY_REQUESTS = 429;

    private final int statusCode;

    public EnrichmentApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public EnrichmentApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }
}
