package io.governor.spi;

import io.governor.model.DeadLetterStatus;
import io.governor.model.PageCursor;

/**
 * Filter and keyset position for a dead-letter listing.
 *
 * @param status     status filter, {@code null} for every status
 * @param recordId   record filter, {@code null} for every record
 * @param after      rows strictly after this cursor, {@code null} for the first page
 * @param limit      maximum rows to return
 * @param includeRaw whether to load {@code raw_message}
 */
public record DeadLetterQuery(DeadLetterStatus status, String recordId, PageCursor after,
                              int limit, boolean includeRaw) {

    public DeadLetterQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
    }
}
