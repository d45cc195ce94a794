package io.atomledger.core.serialization;

import io.atomledger.core.Bytes;
import io.atomledger.core.EUID;
import io.atomledger.core.LedgerException;
import io.atomledger.core.UInt256;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Built-in {@link ValueCodec}s used by the field schemas.
 */
public final class ValueCodecs {
    private ValueCodecs() {}

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public static final ValueCodec<Long> LONG = new ValueCodec<>() {
        @Override
        public void writeDson(Long value, DsonWriter out) {
            out.writeLong(value);
        }

        @Override
        public Object toWire(Long value, Serialization serialization) {
            return value;
        }

        @Override
        public Long fromWire(Object wire, Serialization serialization) {
            if (wire instanceof Long || wire instanceof Integer || wire instanceof Short || wire instanceof Byte) {
                return ((Number) wire).longValue();
            }
            if (wire instanceof BigInteger) {
                BigInteger big = (BigInteger) wire;
                if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                    return big.longValue();
                }
            }
            throw mismatch("integer", wire);
        }
    };

    public static final ValueCodec<Boolean> BOOLEAN = new ValueCodec<>() {
        @Override
        public void writeDson(Boolean value, DsonWriter out) {
            out.writeBoolean(value);
        }

        @Override
        public Object toWire(Boolean value, Serialization serialization) {
            return value;
        }

        @Override
        public Boolean fromWire(Object wire, Serialization serialization) {
            if (wire instanceof Boolean) {
                return (Boolean) wire;
            }
            throw mismatch("boolean", wire);
        }
    };

    /**
     * Plain strings. A string that itself starts with {@code ':'} is escaped with
     * {@link Dson#STRING_PREFIX} so it cannot be confused with a typed value.
     */
    public static final ValueCodec<String> STRING = new ValueCodec<>() {
        @Override
        public void writeDson(String value, DsonWriter out) {
            out.writeString(value);
        }

        @Override
        public Object toWire(String value, Serialization serialization) {
            return value.startsWith(":") ? Dson.STRING_PREFIX + value : value;
        }

        @Override
        public String fromWire(Object wire, Serialization serialization) {
            if (!(wire instanceof String)) {
                throw mismatch("string", wire);
            }
            String s = (String) wire;
            if (s.startsWith(Dson.STRING_PREFIX)) {
                return s.substring(Dson.STRING_PREFIX.length());
            }
            if (s.startsWith(":")) {
                throw new LedgerException.SchemaMismatch("expected string but found typed value: " + s);
            }
            return s;
        }
    };

    public static final ValueCodec<Bytes> BYTES = new ValueCodec<>() {
        @Override
        public void writeDson(Bytes value, DsonWriter out) {
            out.writeBytes(value.toByteArray());
        }

        @Override
        public Object toWire(Bytes value, Serialization serialization) {
            return Dson.BYTES_PREFIX + value.toHex();
        }

        @Override
        public Bytes fromWire(Object wire, Serialization serialization) {
            String hex = prefixed(wire, Dson.BYTES_PREFIX, "bytes");
            try {
                return Bytes.fromHex(hex);
            } catch (IllegalArgumentException e) {
                throw new LedgerException.SchemaMismatch("malformed bytes: " + wire, e);
            }
        }
    };

    public static final ValueCodec<UInt256> UINT256 = new ValueCodec<>() {
        @Override
        public void writeDson(UInt256 value, DsonWriter out) {
            out.writeUInt256(value);
        }

        @Override
        public Object toWire(UInt256 value, Serialization serialization) {
            return Dson.UINT256_PREFIX + value;
        }

        @Override
        public UInt256 fromWire(Object wire, Serialization serialization) {
            String decimal = prefixed(wire, Dson.UINT256_PREFIX, "uint256");
            try {
                return UInt256.parse(decimal);
            } catch (ArithmeticException | NumberFormatException e) {
                throw new LedgerException.SchemaMismatch("malformed uint256: " + wire, e);
            }
        }
    };

    public static final ValueCodec<EUID> IDENTIFIER = new ValueCodec<>() {
        @Override
        public void writeDson(EUID value, DsonWriter out) {
            out.writeEuid(value);
        }

        @Override
        public Object toWire(EUID value, Serialization serialization) {
            return Dson.EUID_PREFIX + value.toHex();
        }

        @Override
        public EUID fromWire(Object wire, Serialization serialization) {
            return EUID.parse(prefixed(wire, Dson.EUID_PREFIX, "identifier"));
        }
    };

    /**
     * Enumerations encoded as their string values in both forms.
     */
    public static <E extends Enum<E>> ValueCodec<E> enumeration(
            Class<E> type, Function<E, String> toValue, Function<String, E> fromValue) {
        Objects.requireNonNull(type, "type");
        return new ValueCodec<>() {
            @Override
            public void writeDson(E value, DsonWriter out) {
                out.writeString(toValue.apply(value));
            }

            @Override
            public Object toWire(E value, Serialization serialization) {
                return toValue.apply(value);
            }

            @Override
            public E fromWire(Object wire, Serialization serialization) {
                if (wire instanceof String) {
                    E value = fromValue.apply((String) wire);
                    if (value != null) {
                        return value;
                    }
                }
                throw mismatch(type.getSimpleName(), wire);
            }
        };
    }

    /**
     * A nested registered object. {@code type} may be an interface; the concrete class is found
     * through the serializer tag.
     */
    public static <T> ValueCodec<T> object(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return new ValueCodec<>() {
            @Override
            public void writeDson(T value, DsonWriter out) {
                out.writeObject(value);
            }

            @Override
            public Object toWire(T value, Serialization serialization) {
                return serialization.toWire(value);
            }

            @Override
            public T fromWire(Object wire, Serialization serialization) {
                return serialization.fromWire(wire, type);
            }
        };
    }

    /**
     * An ordered list. Element order is kept in both forms.
     */
    public static <E> ValueCodec<List<E>> list(ValueCodec<E> element) {
        return new ListCodec<>(element, false);
    }

    /**
     * A list whose order carries no meaning. The wire form keeps insertion order, while the canonical
     * form sorts elements by the unsigned lexicographic order of their own canonical encodings.
     */
    public static <E> ValueCodec<List<E>> unorderedList(ValueCodec<E> element) {
        return new ListCodec<>(element, true);
    }

    /**
     * A map with string keys. Canonical entries are sorted by the UTF-8 bytes of the key.
     */
    public static <V> ValueCodec<Map<String, V>> stringMap(ValueCodec<V> value) {
        return new MapCodec<>(Function.identity(), Function.identity(), value);
    }

    /**
     * A map keyed by identifier; keys travel as hex text.
     */
    public static <V> ValueCodec<Map<EUID, V>> euidMap(ValueCodec<V> value) {
        return new MapCodec<>(EUID::toHex, EUID::parse, value);
    }

    private static final class ListCodec<E> implements ValueCodec<List<E>> {
        private final ValueCodec<E> element;
        private final boolean sorted;

        private ListCodec(ValueCodec<E> element, boolean sorted) {
            this.element = Objects.requireNonNull(element, "element");
            this.sorted = sorted;
        }

        @Override
        public void writeDson(List<E> value, DsonWriter out) {
            out.writeArrayHeader(value.size());
            if (!sorted) {
                for (E e : value) {
                    element.writeDson(e, out);
                }
                return;
            }
            List<byte[]> encoded = new ArrayList<>(value.size());
            for (E e : value) {
                DsonWriter w = out.fork();
                element.writeDson(e, w);
                encoded.add(w.toByteArray());
            }
            encoded.sort(Arrays::compareUnsigned);
            for (byte[] e : encoded) {
                out.writeEncoded(e);
            }
        }

        @Override
        public Object toWire(List<E> value, Serialization serialization) {
            List<Object> out = new ArrayList<>(value.size());
            for (E e : value) {
                out.add(element.toWire(e, serialization));
            }
            return out;
        }

        @Override
        public List<E> fromWire(Object wire, Serialization serialization) {
            if (!(wire instanceof List)) {
                throw mismatch("array", wire);
            }
            List<?> in = (List<?>) wire;
            List<E> out = new ArrayList<>(in.size());
            for (Object e : in) {
                out.add(element.fromWire(e, serialization));
            }
            return out;
        }

        @Override
        public boolean isEmpty(List<E> value) {
            return value.isEmpty();
        }
    }

    private static final class MapCodec<K, V> implements ValueCodec<Map<K, V>> {
        private final Function<K, String> keyToText;
        private final Function<String, K> keyFromText;
        private final ValueCodec<V> value;

        private MapCodec(Function<K, String> keyToText, Function<String, K> keyFromText, ValueCodec<V> value) {
            this.keyToText = keyToText;
            this.keyFromText = keyFromText;
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public void writeDson(Map<K, V> map, DsonWriter out) {
            List<Map.Entry<String, V>> entries = new ArrayList<>(map.size());
            for (Map.Entry<K, V> e : map.entrySet()) {
                entries.add(Map.entry(keyToText.apply(e.getKey()), e.getValue()));
            }
            entries.sort(Comparator.comparing(
                    (Map.Entry<String, V> e) -> e.getKey().getBytes(StandardCharsets.UTF_8), Arrays::compareUnsigned));
            out.writeMapHeader(entries.size());
            for (Map.Entry<String, V> e : entries) {
                out.writeKey(e.getKey());
                value.writeDson(e.getValue(), out);
            }
        }

        @Override
        public Object toWire(Map<K, V> map, Serialization serialization) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<K, V> e : map.entrySet()) {
                out.put(keyToText.apply(e.getKey()), value.toWire(e.getValue(), serialization));
            }
            return out;
        }

        @Override
        public Map<K, V> fromWire(Object wire, Serialization serialization) {
            if (!(wire instanceof Map)) {
                throw mismatch("object", wire);
            }
            Map<K, V> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) wire).entrySet()) {
                if (!(e.getKey() instanceof String)) {
                    throw mismatch("string key", e.getKey());
                }
                out.put(keyFromText.apply((String) e.getKey()), value.fromWire(e.getValue(), serialization));
            }
            return out;
        }

        @Override
        public boolean isEmpty(Map<K, V> map) {
            return map.isEmpty();
        }
    }

    private static String prefixed(Object wire, String prefix, String expected) {
        if (wire instanceof String && ((String) wire).startsWith(prefix)) {
            return ((String) wire).substring(prefix.length());
        }
        throw mismatch(expected, wire);
    }

    private static LedgerException.SchemaMismatch mismatch(String expected, Object actual) {
        String found = actual == null ? "null" : actual.getClass().getSimpleName() + " " + actual;
        return new LedgerException.SchemaMismatch("expected " + expected + " but found " + found);
    }
}
