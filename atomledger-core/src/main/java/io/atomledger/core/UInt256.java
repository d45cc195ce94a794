package io.atomledger.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Unsigned 256-bit integer used for token amounts and granularity.
 */
public final class UInt256 implements Comparable<UInt256> {

    public static final int BYTES = 32;

    private static final BigInteger LIMIT = BigInteger.ONE.shiftLeft(BYTES * 8);

    public static final UInt256 ZERO = new UInt256(BigInteger.ZERO);
    public static final UInt256 ONE = new UInt256(BigInteger.ONE);
    public static final UInt256 MAX = new UInt256(LIMIT.subtract(BigInteger.ONE));

    private final BigInteger value;

    private UInt256(BigInteger value) {
        this.value = value;
    }

    public static UInt256 of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0 || value.compareTo(LIMIT) >= 0) {
            throw new ArithmeticException("value out of uint256 range: " + value);
        }
        return new UInt256(value);
    }

    public static UInt256 of(long value) {
        return of(BigInteger.valueOf(value));
    }

    /**
     * Parses a decimal string.
     */
    public static UInt256 parse(String decimal) {
        Objects.requireNonNull(decimal, "decimal");
        return of(new BigInteger(decimal));
    }

    public static UInt256 fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != BYTES) {
            throw new IllegalArgumentException("uint256 must be " + BYTES + " bytes, got " + bytes.length);
        }
        return new UInt256(new BigInteger(1, bytes));
    }

    public UInt256 add(UInt256 other) {
        return of(value.add(other.value));
    }

    public UInt256 subtract(UInt256 other) {
        return of(value.subtract(other.value));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public BigInteger toBigInteger() {
        return value;
    }

    /**
     * Fixed-width, big-endian form.
     */
    public byte[] toByteArray() {
        byte[] raw = value.toByteArray();
        byte[] fixed = new byte[BYTES];
        int copy = Math.min(raw.length, BYTES);
        System.arraycopy(raw, raw.length - copy, fixed, BYTES - copy, copy);
        return fixed;
    }

    @Override
    public int compareTo(UInt256 o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof UInt256)) return false;
        return value.equals(((UInt256) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
