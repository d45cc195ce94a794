package io.atomledger.core.serialization;

import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * One row of a {@link TypeSchema}: a named, ordered field with its value codec and inclusion flags.
 *
 * <p>Fields that are not {@link #readable()} (derived values such as content identifiers, and
 * constants such as the schema version) are written but never read back.
 *
 * @param <T> the owning type
 * @param <V> the field value type
 */
public final class FieldSchema<T, V> {

    private final String name;
    private final int ordinal;
    private final ValueCodec<V> codec;
    private final BiFunction<T, Serialization, V> accessor;
    private final Set<Output> outputs;
    private final boolean optional;
    private final boolean readable;

    FieldSchema(String name, int ordinal, ValueCodec<V> codec, BiFunction<T, Serialization, V> accessor,
                Set<Output> outputs, boolean optional, boolean readable) {
        this.name = Objects.requireNonNull(name, "name");
        this.ordinal = ordinal;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.outputs = Set.copyOf(outputs);
        this.optional = optional;
        this.readable = readable;
        if (this.outputs.isEmpty()) {
            throw new IllegalArgumentException("field " + name + " is included in no output");
        }
    }

    public String name() {
        return name;
    }

    public int ordinal() {
        return ordinal;
    }

    public boolean includedIn(Output output) {
        return outputs.contains(output);
    }

    /**
     * True if a missing or empty value is omitted instead of rejected.
     */
    public boolean optional() {
        return optional;
    }

    public boolean readable() {
        return readable;
    }

    /**
     * Reads the field from {@code owner}. Returns {@code null} when the value is to be omitted.
     */
    V valueOf(T owner, Serialization serialization) {
        V value = accessor.apply(owner, serialization);
        if (value == null || (optional && codec.isEmpty(value))) {
            if (!optional) {
                throw new IllegalStateException("required field " + name + " is null");
            }
            return null;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    void writeDson(Object value, DsonWriter out) {
        codec.writeDson((V) value, out);
    }

    @SuppressWarnings("unchecked")
    Object toWire(Object value, Serialization serialization) {
        return codec.toWire((V) value, serialization);
    }

    V fromWire(Object wire, Serialization serialization) {
        return codec.fromWire(wire, serialization);
    }

    @Override
    public String toString() {
        return name + "#" + ordinal + outputs;
    }
}
