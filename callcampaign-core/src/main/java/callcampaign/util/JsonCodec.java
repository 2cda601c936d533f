package callcampaign.util;

import java.util.Map;

/**
 * Codec for the flat JSON objects exchanged with the calling service and stored in JDBC columns.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a lightweight, zero-dependency
 * encoder/decoder for objects whose values are strings, numbers, booleans or null. Users who
 * already have Jackson, Gson, or another JSON library on the classpath can implement this
 * interface to delegate to their preferred library.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
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
     * Encodes a field map as a JSON object. Values may be {@link String}, {@link Number},
     * {@link Boolean} or {@code null}.
     *
     * @param fields the fields to encode, in iteration order
     * @return JSON object string, {@code "{}"} for an empty map
     * @throws IllegalArgumentException if a key is null or a value has an unsupported type
     */
    String toJson(Map<String, ?> fields);

    /**
     * Parses a JSON object into a map of its scalar members. Strings are unescaped, numbers and
     * booleans are kept as their JSON text. Null members and nested objects or arrays are
     * skipped. Returns an empty map for {@code null}, empty, or {@code "null"} input.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, String> parseObject(String json);
}
