// file: core/src/main/java/io/hybriddb/core/Json.java
package io.hybriddb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mappers.
 * <p>
 * {@link #MAPPER} is the general-purpose mapper; {@link #CANONICAL} sorts map
 * keys so that two structurally equal documents serialize to the same bytes
 * (used for content digests).
 */
public final class Json {
    public static final ObjectMapper MAPPER = new ObjectMapper();

    public static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Json() {}

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON-serializable", e);
        }
    }

    public static byte[] canonicalBytes(Object value) {
        try {
            return CANONICAL.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON-serializable", e);
        }
    }
}
