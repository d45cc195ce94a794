package io.atomledger.core.serialization;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Field table and factory for one serializable type.
 *
 * <p>Build schemas explicitly, once, at registration time:
 * <pre>{@code
 * TypeSchema<ChronoQuark> schema = TypeSchema.builder("CHRONOQUARK", ChronoQuark.class)
 *     .field("timeKey", ValueCodecs.STRING, ChronoQuark::timeKey)
 *     .field("timestamp", ValueCodecs.LONG, ChronoQuark::timestamp)
 *     .factory(v -> new ChronoQuark(v.get("timeKey"), v.get("timestamp")))
 *     .build();
 * }</pre>
 *
 * <p>Fields are visited in declaration order in both outputs. Every schema also carries a
 * canonical-only {@value Dson#VERSION} field, written last.
 *
 * @param <T> the described type
 */
public final class TypeSchema<T> {

    private final String tag;
    private final Class<T> type;
    private final List<FieldSchema<T, ?>> fields;
    private final Function<FieldValues, T> factory;

    private TypeSchema(String tag, Class<T> type, List<FieldSchema<T, ?>> fields, Function<FieldValues, T> factory) {
        this.tag = tag;
        this.type = type;
        this.fields = List.copyOf(fields);
        this.factory = factory;
    }

    public static <T> Builder<T> builder(String tag, Class<T> type) {
        return new Builder<>(tag, type);
    }

    /**
     * The serializer tag embedded in both outputs.
     */
    public String tag() {
        return tag;
    }

    public Class<T> type() {
        return type;
    }

    /**
     * Fields in ordinal order.
     */
    public List<FieldSchema<T, ?>> fields() {
        return fields;
    }

    T create(FieldValues values) {
        return factory.apply(values);
    }

    @Override
    public String toString() {
        return tag + fields;
    }

    /**
     * Builder for {@link TypeSchema}.
     */
    public static final class Builder<T> {
        private final String tag;
        private final Class<T> type;
        private final List<FieldSchema<T, ?>> fields = new ArrayList<>();
        private Function<FieldValues, T> factory;

        private Builder(String tag, Class<T> type) {
            this.tag = Objects.requireNonNull(tag, "tag");
            this.type = Objects.requireNonNull(type, "type");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("tag must not be blank");
            }
        }

        /**
         * A required field. With no {@code outputs} given it is included in both.
         */
        public <V> Builder<T> field(String name, ValueCodec<V> codec, Function<T, V> getter, Output... outputs) {
            Objects.requireNonNull(getter, "getter");
            return add(name, codec, (owner, s) -> getter.apply(owner), outputs, false, true);
        }

        /**
         * A field that is omitted when {@code null} or empty, and may be absent on the wire.
         */
        public <V> Builder<T> optionalField(String name, ValueCodec<V> codec, Function<T, V> getter, Output... outputs) {
            Objects.requireNonNull(getter, "getter");
            return add(name, codec, (owner, s) -> getter.apply(owner), outputs, true, true);
        }

        /**
         * A write-only field computed from the owner, e.g. a content identifier.
         */
        public <V> Builder<T> derivedField(String name, ValueCodec<V> codec,
                                           BiFunction<T, Serialization, V> accessor, Output... outputs) {
            return add(name, codec, accessor, outputs, false, false);
        }

        public Builder<T> factory(Function<FieldValues, T> factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public TypeSchema<T> build() {
            if (factory == null) {
                throw new IllegalStateException("no factory for " + tag);
            }
            List<FieldSchema<T, ?>> all = new ArrayList<>(fields);
            all.add(new FieldSchema<T, Long>(Dson.VERSION, all.size(), ValueCodecs.LONG,
                    (owner, s) -> Dson.DEFAULT_VERSION,
                    EnumSet.of(Output.DSON), false, false));

            Set<String> names = new HashSet<>();
            for (FieldSchema<T, ?> f : all) {
                if (Dson.SERIALIZER.equals(f.name()) || !names.add(f.name())) {
                    throw new IllegalArgumentException("duplicate or reserved field name in " + tag + ": " + f.name());
                }
            }
            return new TypeSchema<>(tag, type, all, factory);
        }

        private <V> Builder<T> add(String name, ValueCodec<V> codec, BiFunction<T, Serialization, V> accessor,
                                   Output[] outputs, boolean optional, boolean readable) {
            Set<Output> included = outputs.length == 0
                    ? EnumSet.allOf(Output.class)
                    : EnumSet.copyOf(Arrays.asList(outputs));
            fields.add(new FieldSchema<>(name, fields.size(), codec, accessor, included, optional, readable));
            return this;
        }
    }
}
