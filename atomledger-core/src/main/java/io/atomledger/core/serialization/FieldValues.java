package io.atomledger.core.serialization;

import java.util.Map;
import java.util.Objects;

/**
 * Decoded field values handed to a schema's factory, keyed by field name.
 */
public final class FieldValues {

    private final Map<String, Object> values;

    FieldValues(Map<String, Object> values) {
        this.values = Objects.requireNonNull(values, "values");
    }

    /**
     * Returns the decoded value, or {@code null} for an omitted optional field.
     */
    @SuppressWarnings("unchecked")
    public <V> V get(String name) {
        return (V) values.get(name);
    }

    public <V> V getOrDefault(String name, V defaultValue) {
        V value = get(name);
        return value == null ? defaultValue : value;
    }
}
