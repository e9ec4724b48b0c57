package io.governor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Keyset position in the dead-letter listing, ordered by
 * {@code (failed_at DESC, id DESC)}. The next page starts strictly after it.
 */
public record PageCursor(Instant failedAt, long id) {

    public PageCursor {
        Objects.requireNonNull(failedAt, "failedAt");
    }

    public static PageCursor after(DeadLetterEntry entry) {
        return new PageCursor(entry.failedAt(), entry.id());
    }
}
