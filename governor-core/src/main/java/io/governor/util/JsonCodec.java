package io.governor.util;

import java.util.Map;

/**
 * Codec for flat JSON objects, used for queue payloads and pagination cursors.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and
 * handles only flat objects whose values are strings, numbers, booleans or
 * {@code null}. Applications that already ship Jackson or Gson can plug in their
 * own implementation.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object. Entries with {@code null} values are omitted.
     *
     * @param fields the fields to encode
     * @return JSON object text, {@code "{}"} for a null or empty map
     */
    String toJson(Map<String, String> fields);

    /**
     * Parses a flat JSON object. Number and boolean values are returned as their
     * literal text; {@code null} values are dropped.
     *
     * @param json the JSON text
     * @return parsed fields in document order (never {@code null})
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
