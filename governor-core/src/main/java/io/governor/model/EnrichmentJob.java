package io.governor.model;

import io.governor.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Queue payload asking for one catalog record to be enriched.
 *
 * <p>Immutable once enqueued; all mutable state lives in the catalog record and
 * the dead-letter store. The wire form is a flat JSON object with keys
 * {@code recordId}, {@code name} and {@code attribute_hint}.
 *
 * @param recordId      catalog record id
 * @param name          record name
 * @param attributeHint optional lookup hint, may be {@code null}
 */
public record EnrichmentJob(String recordId, String name, String attributeHint) {
    static final String RECORD_ID = "recordId";
    static final String NAME = "name";
    static final String ATTRIBUTE_HINT = "attribute_hint";

    public EnrichmentJob {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId must not be blank");
        }
        Objects.requireNonNull(name, "name");
    }

    public String toJson(JsonCodec codec) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(RECORD_ID, recordId);
        fields.put(NAME, name);
        fields.put(ATTRIBUTE_HINT, attributeHint);
        return codec.toJson(fields);
    }

    public String toJson() {
        return toJson(JsonCodec.getDefault());
    }

    /**
     * Parses and structurally validates a stored payload.
     *
     * @throws IllegalArgumentException if the payload is not a JSON object or
     *     lacks {@code recordId} or {@code name}
     */
    public static EnrichmentJob fromJson(String json, JsonCodec codec) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty job payload");
        }
        Map<String, String> fields = codec.parseObject(json);
        String recordId = fields.get(RECORD_ID);
        String name = fields.get(NAME);
        if (recordId == null || name == null) {
            throw new IllegalArgumentException("Job payload missing recordId or name");
        }
        return new EnrichmentJob(recordId, name, fields.get(ATTRIBUTE_HINT));
    }

    public static EnrichmentJob fromJson(String json) {
        return fromJson(json, JsonCodec.getDefault());
    }
}
