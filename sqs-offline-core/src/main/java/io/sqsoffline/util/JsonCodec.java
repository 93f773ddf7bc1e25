package io.sqsoffline.util;

import java.util.Map;

/**
 * Minimal JSON codec used for redrive policies and dead-letter envelopes.
 *
 * <p>Values are represented with plain Java types: {@link Map} (objects, insertion ordered),
 * {@link java.util.List} (arrays), {@link String}, {@link Number}, {@link Boolean} and
 * {@code null}. The default implementation ({@link DefaultJsonCodec}) has no external
 * dependencies. Users who already have Jackson or Gson on the classpath can implement this
 * interface to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value tree as JSON.
     *
     * @param value a map, list, string, number, boolean, {@link java.time.temporal.TemporalAccessor} or {@code null}
     * @return the JSON text
     * @throws IllegalArgumentException if the tree contains an unsupported type or a null map key
     */
    String toJson(Object value);

    /**
     * Parses JSON text into a value tree.
     *
     * @param json the JSON text
     * @return the parsed value ({@code null} for the literal {@code null})
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    Object parse(String json);

    /**
     * Parses a JSON object. Returns an empty map for {@code null} or blank input.
     *
     * @param json the JSON text
     * @return the parsed object (never {@code null})
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        Object value = parse(json);
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected JSON object");
        }
        return (Map<String, Object>) value;
    }
}
