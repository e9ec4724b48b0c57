package io.governor.dead;

/**
 * Parameters of a dead-letter listing.
 *
 * @param status     status code, {@code "all"} for no filter; {@code null} means {@code pending}
 * @param recordId   optional record filter
 * @param limit      page size, capped at {@link #MAX_LIMIT}
 * @param cursor     opaque cursor from a previous page, or {@code null}
 * @param includeRaw whether entries carry {@code raw_message}
 */
public record ListRequest(String status, String recordId, int limit, String cursor, boolean includeRaw) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;
    public static final String ALL_STATUSES = "all";

    /** First page of pending entries, default page size. */
    public static ListRequest pending() {
        return new ListRequest(null, null, DEFAULT_LIMIT, null, false);
    }

    public ListRequest withStatus(String status) {
        return new ListRequest(status, recordId, limit, cursor, includeRaw);
    }

    public ListRequest withRecordId(String recordId) {
        return new ListRequest(status, recordId, limit, cursor, includeRaw);
    }

    public ListRequest withLimit(int limit) {
        return new ListRequest(status, recordId, limit, cursor, includeRaw);
    }

    public ListRequest withCursor(String cursor) {
        return new ListRequest(status, recordId, limit, cursor, includeRaw);
    }

    public ListRequest withRaw(boolean includeRaw) {
        return new ListRequest(status, recordId, limit, cursor, includeRaw);
    }
}
