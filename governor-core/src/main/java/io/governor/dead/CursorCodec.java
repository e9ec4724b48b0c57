package io.governor.dead;

import io.governor.model.PageCursor;
import io.governor.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opaque encoding of {@link PageCursor}: URL-safe Base64 over
 * {@code {"failed_at":<epoch millis>,"id":<id>}}.
 */
final class CursorCodec {
    private static final String FAILED_AT = "failed_at";
    private static final String ID = "id";

    private final JsonCodec json;

    CursorCodec(JsonCodec json) {
        this.json = json;
    }

    String encode(PageCursor cursor) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FAILED_AT, Long.toString(cursor.failedAt().toEpochMilli()));
        fields.put(ID, Long.toString(cursor.id()));
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(json.toJson(fields).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws AdminRequestException with {@code INVALID_CURSOR} if the value was not
     *     produced by {@link #encode}
     */
    PageCursor decode(String cursor) {
        try {
            String text = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            Map<String, String> fields = json.parseObject(text);
            String failedAt = fields.get(FAILED_AT);
            String id = fields.get(ID);
            if (failedAt == null || id == null) {
                throw new IllegalArgumentException("cursor missing failed_at or id");
            }
            return new PageCursor(Instant.ofEpochMilli(Long.parseLong(failedAt)), Long.parseLong(id));
        } catch (IllegalArgumentException e) {
            throw new AdminRequestException(AdminRequestException.ErrorCode.INVALID_CURSOR,
                    "Invalid cursor", e);
        }
    }
}
