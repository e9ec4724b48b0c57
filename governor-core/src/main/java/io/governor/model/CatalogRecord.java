package io.governor.model;

import java.util.Objects;

/**
 * The slice of a catalog record the sweep needs to build an {@link EnrichmentJob}.
 *
 * @param id            record id
 * @param name          display name, used for blocklist matching
 * @param attributeHint free-form hint passed to the lookup service (e.g. the brewer)
 * @param status        current enrichment status
 */
public record CatalogRecord(String id, String name, String attributeHint, EnrichmentStatus status) {

    public CatalogRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }

    public EnrichmentJob toJob() {
        return new EnrichmentJob(id, name, attributeHint);
    }
}
