package io.governor.model;

import java.util.Optional;

/**
 * Dead-letter state machine: {@code pending -> replaying -> {replayed | pending}},
 * {@code pending -> acknowledged}. {@link #REPLAYING} never outlives a single
 * replay call.
 */
public enum DeadLetterStatus {
    PENDING("pending"),
    REPLAYING("replaying"),
    REPLAYED("replayed"),
    ACKNOWLEDGED("acknowledged");

    private final String code;

    DeadLetterStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == REPLAYED || this == ACKNOWLEDGED;
    }

    public static DeadLetterStatus fromCode(String code) {
        return find(code).orElseThrow(
                () -> new IllegalArgumentException("Unknown dead-letter status: " + code));
    }

    public static Optional<DeadLetterStatus> find(String code) {
        for (DeadLetterStatus status : values()) {
            if (status.code.equals(code)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
