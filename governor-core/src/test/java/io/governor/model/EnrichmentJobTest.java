package io.governor.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnrichmentJobTest {

    @Test
    void payloadUsesWireFieldNames() {
        EnrichmentJob job = new EnrichmentJob("b-1", "Pale Ale", "Acme Brewing");

        assertEquals("{\"recordId\":\"b-1\",\"name\":\"Pale Ale\",\"attribute_hint\":\"Acme Brewing\"}",
                job.toJson());
    }

    @Test
    void missingHintIsOmittedAndParsedBackAsNull() {
        EnrichmentJob job = new EnrichmentJob("b-2", "Stout", null);

        EnrichmentJob parsed = EnrichmentJob.fromJson(job.toJson());

        assertEquals(job, parsed);
        assertNull(parsed.attributeHint());
    }

    @Test
    void rejectsPayloadWithoutRequiredFields() {
        assertThrows(IllegalArgumentException.class, () -> EnrichmentJob.fromJson("{\"name\":\"x\"}"));
        assertThrows(IllegalArgumentException.class, () -> EnrichmentJob.fromJson("{\"recordId\":\"x\"}"));
        assertThrows(IllegalArgumentException.class, () -> EnrichmentJob.fromJson("  "));
        assertThrows(IllegalArgumentException.class, () -> EnrichmentJob.fromJson("not json"));
    }

    @Test
    void blankRecordIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EnrichmentJob(" ", "x", null));
        assertThrows(NullPointerException.class, () -> new EnrichmentJob("id", null, null));
    }
}
