package io.botpoll.json.spi;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Implementations map Java record components and bean properties to snake_case JSON names,
 * ignore unknown JSON properties, and omit {@code null} values when writing.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    default <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        return readValue(data, ValueType.of(type));
    }

    /**
     * Deserializes JSON bytes to a possibly generic type.
     * @param data JSON bytes
     * @param type target type
     * @return deserialized object
     * @throws JsonException if the data is not valid JSON or does not match {@code type}
     */
    <T> T readValue(byte[] data, ValueType<T> type) throws JsonException;
}
