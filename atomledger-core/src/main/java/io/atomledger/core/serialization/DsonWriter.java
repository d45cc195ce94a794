package io.atomledger.core.serialization;

import io.atomledger.core.EUID;
import io.atomledger.core.UInt256;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Append-only writer for the DSON canonical encoding.
 *
 * <p>Writers are single-use and not thread-safe. Nested objects are written through the
 * {@link Serialization} the writer was created for, so schema lookups stay on one registry.
 */
public final class DsonWriter {

    private final Serialization serialization;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream(128);

    DsonWriter(Serialization serialization) {
        this.serialization = Objects.requireNonNull(serialization, "serialization");
    }

    /**
     * Returns a fresh writer bound to the same registry. Used to encode elements separately
     * when they must be sorted before being appended.
     */
    public DsonWriter fork() {
        return new DsonWriter(serialization);
    }

    public DsonWriter writeBoolean(boolean value) {
        out.write(Dson.BOOLEAN);
        out.write(value ? 1 : 0);
        return this;
    }

    public DsonWriter writeLong(long value) {
        out.write(Dson.INT64);
        writeRawLong(value);
        return this;
    }

    public DsonWriter writeString(String value) {
        out.write(Dson.STRING);
        writeRawString(value);
        return this;
    }

    public DsonWriter writeBytes(byte[] value) {
        out.write(Dson.BYTES);
        writeRawInt(value.length);
        out.writeBytes(value);
        return this;
    }

    public DsonWriter writeUInt256(UInt256 value) {
        out.write(Dson.UINT256);
        out.writeBytes(value.toByteArray());
        return this;
    }

    public DsonWriter writeEuid(EUID value) {
        out.write(Dson.EUID);
        out.writeBytes(value.toByteArray());
        return this;
    }

    public DsonWriter writeArrayHeader(int count) {
        out.write(Dson.ARRAY);
        writeRawInt(count);
        return this;
    }

    public DsonWriter writeMapHeader(int count) {
        out.write(Dson.MAP);
        writeRawInt(count);
        return this;
    }

    /**
     * Writes a map key: length-prefixed UTF-8 without a marker.
     */
    public DsonWriter writeKey(String key) {
        writeRawString(key);
        return this;
    }

    /**
     * Writes a registered object (marker, type tag, field count, fields).
     */
    public DsonWriter writeObject(Object value) {
        serialization.writeDson(value, this);
        return this;
    }

    /**
     * Appends bytes produced by a {@link #fork() forked} writer.
     */
    public DsonWriter writeEncoded(byte[] encoded) {
        out.writeBytes(encoded);
        return this;
    }

    void writeObjectHeader(String tag, int fieldCount) {
        out.write(Dson.OBJECT);
        writeRawString(tag);
        writeRawInt(fieldCount);
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    private void writeRawString(String value) {
        byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
        writeRawInt(utf8.length);
        out.writeBytes(utf8);
    }

    private void writeRawInt(int value) {
        out.write(value >>> 24);
        out.write(value >>> 16);
        out.write(value >>> 8);
        out.write(value);
    }

    private void writeRawLong(long value) {
        writeRawInt((int) (value >>> 32));
        writeRawInt((int) value);
    }
}
