package io.governor.dead;

import java.util.Objects;

/**
 * A dead-letter admin call was rejected before any state changed.
 */
public class AdminRequestException extends RuntimeException {

    /** Structured error codes for admin callers. */
    public enum ErrorCode {
        INVALID_CURSOR,
        INVALID_REQUEST,
        INVALID_ID,
        STORE_UNAVAILABLE
    }

    private final ErrorCode code;

    public AdminRequestException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public AdminRequestException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }
}
