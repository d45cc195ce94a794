package io.atomledger.core;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Immutable byte string. Used for public keys, signatures and opaque payloads.
 */
public final class Bytes implements Comparable<Bytes> {

    private static final HexFormat HEX = HexFormat.of();
    private static final Bytes EMPTY = new Bytes(new byte[0]);

    private final byte[] value;

    private Bytes(byte[] value) {
        this.value = value;
    }

    public static Bytes empty() {
        return EMPTY;
    }

    public static Bytes of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Bytes(bytes.clone());
    }

    public static Bytes fromHex(String hex) {
        Objects.requireNonNull(hex, "hex");
        return new Bytes(HEX.parseHex(hex));
    }

    public int length() {
        return value.length;
    }

    public byte[] toByteArray() {
        return value.clone();
    }

    public String toHex() {
        return HEX.formatHex(value);
    }

    @Override
    public int compareTo(Bytes o) {
        return Arrays.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Bytes)) return false;
        return Arrays.equals(value, ((Bytes) other).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
