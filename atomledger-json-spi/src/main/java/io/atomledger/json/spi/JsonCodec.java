package io.atomledger.json.spi;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>The RPC transport only moves plain trees through this interface: {@code Map}, {@code List},
 * {@code String}, {@code Boolean} and integral numbers. Implementations must read JSON integers
 * as {@code Long} (or {@code BigInteger} when they do not fit) so ledger values keep their width.
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
     * Deserializes a JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;
}
