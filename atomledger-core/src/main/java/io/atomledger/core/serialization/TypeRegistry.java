package io.atomledger.core.serialization;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry that resolves a {@link TypeSchema} by serializer tag or by Java type.
 *
 * <p>Use {@link #builder()} to create a registry with explicit schema registration:
 * <pre>{@code
 * TypeRegistry registry = TypeRegistry.builder()
 *     .register(fungibleQuarkSchema)
 *     .build();
 * }</pre>
 *
 * <p>A built registry is immutable and safe to share between threads.
 */
public final class TypeRegistry {

    private final Map<String, TypeSchema<?>> byTag;
    private final Map<Class<?>, TypeSchema<?>> byType;

    private TypeRegistry(Map<String, TypeSchema<?>> byTag, Map<Class<?>, TypeSchema<?>> byType) {
        this.byTag = Map.copyOf(byTag);
        this.byType = Map.copyOf(byType);
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find a schema by serializer tag.
     *
     * @param tag the serializer tag (e.g. "FUNGIBLEQUARK")
     * @return the schema if registered
     */
    public Optional<TypeSchema<?>> find(String tag) {
        if (tag == null) return Optional.empty();
        return Optional.ofNullable(byTag.get(tag));
    }

    /**
     * Find the schema registered for exactly {@code type}.
     *
     * @param type the Java type
     * @return the schema if registered
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<TypeSchema<T>> find(Class<T> type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable((TypeSchema<T>) byType.get(type));
    }

    public Set<String> tags() {
        return byTag.keySet();
    }

    /**
     * Builder for creating a {@link TypeRegistry} with explicit schema registration.
     */
    public static final class Builder {
        private final Map<String, TypeSchema<?>> byTag = new HashMap<>();
        private final Map<Class<?>, TypeSchema<?>> byType = new HashMap<>();

        private Builder() {}

        /**
         * Register a schema. Tags and types must be unique.
         *
         * @param schema the schema to register
         * @return this builder
         */
        public Builder register(TypeSchema<?> schema) {
            Objects.requireNonNull(schema, "schema");
            if (byTag.containsKey(schema.tag())) {
                throw new IllegalArgumentException("tag already registered: " + schema.tag());
            }
            if (byType.containsKey(schema.type())) {
                throw new IllegalArgumentException("type already registered: " + schema.type().getName());
            }
            byTag.put(schema.tag(), schema);
            byType.put(schema.type(), schema);
            return this;
        }

        /**
         * Register multiple schemas.
         *
         * @param schemas the schemas to register
         * @return this builder
         */
        public Builder registerAll(Iterable<? extends TypeSchema<?>> schemas) {
            for (TypeSchema<?> schema : schemas) {
                register(schema);
            }
            return this;
        }

        /**
         * Build the registry.
         *
         * @return an immutable registry containing the registered schemas
         */
        public TypeRegistry build() {
            return new TypeRegistry(byTag, byType);
        }
    }
}
