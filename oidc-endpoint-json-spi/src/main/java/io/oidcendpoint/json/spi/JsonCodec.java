package io.oidcendpoint.json.spi;

import java.util.Map;

/**
 * Minimal JSON codec interface used to put protocol messages on the wire and read them back.
 * Implementations wrap specific JSON libraries (Jackson, Gson, ...).
 *
 * <p>Messages are flat parameter maps, so the codec only needs to move between JSON text and
 * plain Java values ({@link Map}, {@link java.util.List}, {@link String}, {@link Number},
 * {@link Boolean}).
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes a value to a JSON string.
     * @param value the value to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes a JSON object into an insertion-ordered map.
     * @param json JSON string (must be a JSON object)
     * @return the members of the object
     * @throws JsonException if the text is not valid JSON or not an object
     */
    Map<String, Object> readMap(String json) throws JsonException;
}
