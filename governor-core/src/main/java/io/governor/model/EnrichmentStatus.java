package io.governor.model;

/**
 * Enrichment state of a catalog record. Persisted as its lowercase {@link #code()}.
 *
 * <p>Only {@link #PENDING} records are eligible for enrichment; the other three
 * states are terminal as far as the sweep is concerned.
 */
public enum EnrichmentStatus {
    PENDING("pending"),
    ENRICHED("enriched"),
    NOT_FOUND("not_found"),
    SKIPPED("skipped");

    private final String code;

    EnrichmentStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static EnrichmentStatus fromCode(String code) {
        for (EnrichmentStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown enrichment status: " + code);
    }
}
