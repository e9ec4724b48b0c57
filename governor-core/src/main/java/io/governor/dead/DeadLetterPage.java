package io.governor.dead;

import io.governor.model.DeadLetterEntry;

import java.util.List;

/**
 * One page of dead letters.
 *
 * @param entries    rows, newest failure first
 * @param totalCount rows matching the filter across all pages
 * @param nextCursor cursor for the following page, {@code null} on the last page
 * @param hasMore    whether another page exists
 */
public record DeadLetterPage(List<DeadLetterEntry> entries, int totalCount, String nextCursor, boolean hasMore) {
}
