package io.atomledger.core.serialization;

/**
 * Constants for the DSON canonical encoding and the typed-string prefixes of the wire encoding.
 *
 * <p>Every DSON value starts with one marker byte. Lengths and counts are 4-byte big-endian
 * unsigned integers, integers are 8-byte big-endian.
 */
public final class Dson {
    private Dson() {
        throw new IllegalStateException("Can't construct");
    }

    // DSON value markers
    public static final byte BOOLEAN = 0x01;
    public static final byte INT64 = 0x02;
    public static final byte STRING = 0x03;
    public static final byte BYTES = 0x04;
    public static final byte UINT256 = 0x05;
    public static final byte EUID = 0x06;
    public static final byte ARRAY = 0x07;
    public static final byte MAP = 0x08;
    public static final byte OBJECT = 0x09;

    // Type tag prefixes used in strings for wire mappings
    public static final String BYTES_PREFIX = ":b:";
    public static final String UINT256_PREFIX = ":u:";
    public static final String EUID_PREFIX = ":uid:";
    public static final String STRING_PREFIX = ":str:";

    /** Wire key carrying the type tag of an object. */
    public static final String SERIALIZER = "serializer";

    /** Canonical-only field carrying the schema version of an object. */
    public static final String VERSION = "version";

    public static final long DEFAULT_VERSION = 100L;
}
