package io.atomledger.core;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Extended unique identifier: an unsigned 128-bit integer.
 *
 * <p>The canonical byte form is exactly {@link #BYTES} bytes, big-endian. The textual form is
 * {@code 2 * BYTES} lowercase hex digits. Both round-trip exactly.
 */
public final class EUID implements Comparable<EUID> {

    public static final int BYTES = 16;

    private static final BigInteger LIMIT = BigInteger.ONE.shiftLeft(BYTES * 8);
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] value;

    private EUID(byte[] value) {
        this.value = value;
    }

    public static EUID of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0 || value.compareTo(LIMIT) >= 0) {
            throw new LedgerException.MalformedIdentifier("identifier out of range: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] fixed = new byte[BYTES];
        int copy = Math.min(raw.length, BYTES);
        System.arraycopy(raw, raw.length - copy, fixed, BYTES - copy, copy);
        return new EUID(fixed);
    }

    public static EUID of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static EUID fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTES) {
            throw new LedgerException.MalformedIdentifier(
                    "identifier must be " + BYTES + " bytes, got " + bytes.length);
        }
        return new EUID(bytes.clone());
    }

    /**
     * Parses the {@code 2 * BYTES} hex digit textual form.
     */
    public static EUID parse(String hex) {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != BYTES * 2) {
            throw new LedgerException.MalformedIdentifier("identifier must be " + (BYTES * 2) + " hex digits: " + hex);
        }
        try {
            return new EUID(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new LedgerException.MalformedIdentifier("identifier is not hex: " + hex, e);
        }
    }

    /**
     * Derives an identifier from the leading bytes of a content hash.
     */
    public static EUID fromHash(byte[] hash) {
        Objects.requireNonNull(hash, "hash");
        if (hash.length < BYTES) {
            throw new LedgerException.MalformedIdentifier("hash shorter than " + BYTES + " bytes");
        }
        return new EUID(Arrays.copyOf(hash, BYTES));
    }

    public byte[] toByteArray() {
        return value.clone();
    }

    public BigInteger toBigInteger() {
        return new BigInteger(1, value);
    }

    public String toHex() {
        return HEX.formatHex(value);
    }

    @Override
    public int compareTo(EUID o) {
        return Arrays.compareUnsigned(value, o.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof EUID)) return false;
        return Arrays.equals(value, ((EUID) other).value);
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
