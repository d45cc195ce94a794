package io.atomledger.core.serialization;

/**
 * Encodes one field value into both external forms and decodes it back from the wire form.
 *
 * <p>Implementations must be stateless; the canonical form has to be a pure function of the value.
 *
 * @param <V> the Java type of the field value
 */
public interface ValueCodec<V> {

    /**
     * Appends the canonical encoding of {@code value}.
     */
    void writeDson(V value, DsonWriter out);

    /**
     * Returns the wire form: a {@code Map}, {@code List}, {@code String}, {@code Number} or {@code Boolean}.
     */
    Object toWire(V value, Serialization serialization);

    /**
     * Rebuilds a value from its wire form.
     *
     * @throws io.atomledger.core.LedgerException.SchemaMismatch if the wire value has the wrong shape
     */
    V fromWire(Object wire, Serialization serialization);

    /**
     * True if an empty value of this codec should be omitted like {@code null} when optional.
     */
    default boolean isEmpty(V value) {
        return false;
    }
}
