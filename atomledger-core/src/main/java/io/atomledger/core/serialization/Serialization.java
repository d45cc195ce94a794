package io.atomledger.core.serialization;

import io.atomledger.core.Bytes;
import io.atomledger.core.EUID;
import io.atomledger.core.LedgerException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema-driven serializer bound to one {@link TypeRegistry}.
 *
 * <p>Produces two external forms for every registered object:
 * <ul>
 *   <li>DSON: the canonical, deterministic byte form used for hashing and signing. One-way.</li>
 *   <li>Wire: nested {@code Map}/{@code List}/scalar values ready for a JSON codec, carrying a
 *       {@value Dson#SERIALIZER} tag on every object so the form is self-describing.</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class Serialization {

    private static final String HASH_ALGORITHM = "SHA-256";

    private final TypeRegistry registry;

    public Serialization(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public TypeRegistry registry() {
        return registry;
    }

    /**
     * Canonical DSON bytes of a registered object: a pure function of its DSON-included fields.
     *
     * @throws LedgerException.UnknownType if the object's type is not registered
     */
    public byte[] toCanonicalBytes(Object value) {
        DsonWriter out = new DsonWriter(this);
        writeDson(value, out);
        return out.toByteArray();
    }

    /**
     * SHA-256 over the canonical bytes.
     */
    public Bytes hash(Object value) {
        return Bytes.of(sha256(toCanonicalBytes(value)));
    }

    /**
     * Content identifier: the leading {@value EUID#BYTES} bytes of {@link #hash(Object)}.
     */
    public EUID hid(Object value) {
        return EUID.fromHash(sha256(toCanonicalBytes(value)));
    }

    /**
     * Wire form of a registered object.
     *
     * @throws LedgerException.UnknownType if the object's type is not registered
     */
    public Map<String, Object> toWire(Object value) {
        return toWire(schemaOf(value), value);
    }

    /**
     * Rebuilds an object from its wire form. The embedded serializer tag selects the schema; when the
     * tag is absent the schema registered for {@code expectedType} is used.
     *
     * @throws LedgerException.UnknownType if the tag (or a missing tag's expected type) is not registered
     * @throws LedgerException.SchemaMismatch if a required field is missing or has the wrong shape
     */
    public <T> T fromWire(Object wire, Class<T> expectedType) {
        Objects.requireNonNull(expectedType, "expectedType");
        if (!(wire instanceof Map)) {
            throw new LedgerException.SchemaMismatch("expected object for " + expectedType.getSimpleName()
                    + " but found " + (wire == null ? "null" : wire.getClass().getSimpleName()));
        }
        Map<?, ?> map = (Map<?, ?>) wire;
        TypeSchema<?> schema = resolve(map.get(Dson.SERIALIZER), expectedType);
        if (!expectedType.isAssignableFrom(schema.type())) {
            throw new LedgerException.SchemaMismatch(schema.tag() + " is not a " + expectedType.getSimpleName());
        }
        return expectedType.cast(decode(schema, map));
    }

    /**
     * Rebuilds an object of whatever registered type its serializer tag names.
     */
    public Object fromWire(Object wire) {
        return fromWire(wire, Object.class);
    }

    /**
     * Rebuilds each element of a wire array, in order.
     */
    public <T> List<T> fromWireList(Object wire, Class<T> elementType) {
        if (!(wire instanceof List)) {
            throw new LedgerException.SchemaMismatch("expected array of " + elementType.getSimpleName()
                    + " but found " + (wire == null ? "null" : wire.getClass().getSimpleName()));
        }
        List<?> in = (List<?>) wire;
        List<T> out = new ArrayList<>(in.size());
        for (Object element : in) {
            out.add(fromWire(element, elementType));
        }
        return out;
    }

    void writeDson(Object value, DsonWriter out) {
        writeDson(schemaOf(value), value, out);
    }

    private <T> void writeDson(TypeSchema<T> schema, Object value, DsonWriter out) {
        T owner = schema.type().cast(value);
        List<FieldSchema<T, ?>> fields = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (FieldSchema<T, ?> field : schema.fields()) {
            if (!field.includedIn(Output.DSON)) continue;
            Object v = field.valueOf(owner, this);
            if (v == null) continue;
            fields.add(field);
            values.add(v);
        }
        out.writeObjectHeader(schema.tag(), fields.size());
        for (int i = 0; i < fields.size(); i++) {
            out.writeKey(fields.get(i).name());
            fields.get(i).writeDson(values.get(i), out);
        }
    }

    private <T> Map<String, Object> toWire(TypeSchema<T> schema, Object value) {
        T owner = schema.type().cast(value);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Dson.SERIALIZER, schema.tag());
        for (FieldSchema<T, ?> field : schema.fields()) {
            if (!field.includedIn(Output.WIRE)) continue;
            Object v = field.valueOf(owner, this);
            if (v == null) continue;
            out.put(field.name(), field.toWire(v, this));
        }
        return out;
    }

    private <T> T decode(TypeSchema<T> schema, Map<?, ?> map) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSchema<T, ?> field : schema.fields()) {
            if (!field.includedIn(Output.WIRE) || !field.readable()) continue;
            Object raw = map.get(field.name());
            if (raw == null) {
                if (field.optional()) continue;
                throw new LedgerException.SchemaMismatch(
                        "missing required field '" + field.name() + "' in " + schema.tag());
            }
            values.put(field.name(), field.fromWire(raw, this));
        }
        try {
            return schema.create(new FieldValues(values));
        } catch (IllegalArgumentException | NullPointerException | ClassCastException e) {
            throw new LedgerException.SchemaMismatch("invalid " + schema.tag() + ": " + e.getMessage(), e);
        }
    }

    private TypeSchema<?> resolve(Object tag, Class<?> expectedType) {
        if (tag == null) {
            return registry.find(expectedType).orElseThrow(() -> new LedgerException.UnknownType(null,
                    "missing serializer tag and no schema registered for " + expectedType.getName()));
        }
        if (!(tag instanceof String)) {
            throw new LedgerException.SchemaMismatch("serializer tag must be a string: " + tag);
        }
        String name = (String) tag;
        return registry.find(name).orElseThrow(() ->
                new LedgerException.UnknownType(name, "unknown serializer tag: " + name));
    }

    private TypeSchema<?> schemaOf(Object value) {
        Objects.requireNonNull(value, "value");
        return registry.find(value.getClass()).orElseThrow(() -> new LedgerException.UnknownType(null,
                "no schema registered for " + value.getClass().getName()));
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }
}
