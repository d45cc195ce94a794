package io.atomledger.core.serialization;

import io.atomledger.core.Bytes;
import io.atomledger.core.LedgerException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerializationTest {

    record Sample(String name, long count, String secret, String note) {}

    record Tagged(List<Sample> samples, Map<String, Long> weights) {}

    static final TypeSchema<Sample> SAMPLE = TypeSchema.builder("SAMPLE", Sample.class)
            .field("name", ValueCodecs.STRING, Sample::name)
            .field("count", ValueCodecs.LONG, Sample::count, Output.DSON)
            .field("secret", ValueCodecs.STRING, Sample::secret, Output.WIRE)
            .optionalField("note", ValueCodecs.STRING, Sample::note)
            .factory(v -> new Sample(v.get("name"), v.getOrDefault("count", 0L), v.get("secret"), v.get("note")))
            .build();

    static final TypeSchema<Tagged> TAGGED = TypeSchema.builder("TAGGED", Tagged.class)
            .field("samples", ValueCodecs.unorderedList(ValueCodecs.object(Sample.class)), Tagged::samples)
            .optionalField("weights", ValueCodecs.stringMap(ValueCodecs.LONG), Tagged::weights)
            .factory(v -> new Tagged(v.get("samples"), v.getOrDefault("weights", Map.of())))
            .build();

    private final Serialization serialization =
            new Serialization(TypeRegistry.builder().register(SAMPLE).register(TAGGED).build());

    @Test
    void canonicalLayoutFollowsSchemaOrder() {
        byte[] actual = serialization.toCanonicalBytes(new Sample("a", 3, "s", null));

        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        expected.write(Dson.OBJECT);
        raw(expected, "SAMPLE");
        int32(expected, 3);
        raw(expected, "name");
        expected.write(Dson.STRING);
        raw(expected, "a");
        raw(expected, "count");
        expected.write(Dson.INT64);
        expected.writeBytes(new byte[]{0, 0, 0, 0, 0, 0, 0, 3});
        raw(expected, "version");
        expected.write(Dson.INT64);
        expected.writeBytes(new byte[]{0, 0, 0, 0, 0, 0, 0, 100});

        assertThat(actual).containsExactly(expected.toByteArray());
    }

    @Test
    void wireOnlyFieldsDoNotAffectCanonicalForm() {
        Sample a = new Sample("a", 3, "one", null);
        Sample b = new Sample("a", 3, "two", null);
        assertThat(serialization.toCanonicalBytes(a)).isEqualTo(serialization.toCanonicalBytes(b));
        assertThat(serialization.hash(a)).isEqualTo(serialization.hash(b));
        assertThat(serialization.hid(a)).isEqualTo(serialization.hid(b));
    }

    @Test
    void canonicalOnlyFieldsStayOffTheWire() {
        Map<String, Object> wire = serialization.toWire(new Sample("a", 3, "s", "n"));
        assertThat(wire).containsExactly(
                Map.entry("serializer", "SAMPLE"),
                Map.entry("name", "a"),
                Map.entry("secret", "s"),
                Map.entry("note", "n"));
    }

    @Test
    void unorderedCollectionsHashTheSameInAnyOrder() {
        Sample x = new Sample("x", 1, "s", null);
        Sample y = new Sample("y", 2, "s", null);
        Map<String, Long> forward = new LinkedHashMap<>();
        forward.put("a", 1L);
        forward.put("b", 2L);
        Map<String, Long> backward = new LinkedHashMap<>();
        backward.put("b", 2L);
        backward.put("a", 1L);

        Bytes one = serialization.hash(new Tagged(List.of(x, y), forward));
        Bytes two = serialization.hash(new Tagged(List.of(y, x), backward));

        assertThat(one).isEqualTo(two);
        assertThat(one.length()).isEqualTo(32);
    }

    @Test
    void emptyOptionalCollectionIsOmitted() {
        Map<String, Object> wire = serialization.toWire(new Tagged(List.of(), Map.of()));
        assertThat(wire).containsOnlyKeys("serializer", "samples");
    }

    @Test
    void wireRoundTripRestoresReadableFields() {
        Sample sample = new Sample(":looks-typed", 9, "s", null);
        Map<String, Object> wire = serialization.toWire(sample);
        assertThat(wire.get("name")).isEqualTo(":str::looks-typed");

        Sample decoded = serialization.fromWire(wire, Sample.class);
        assertThat(decoded.name()).isEqualTo(":looks-typed");
        assertThat(decoded.secret()).isEqualTo("s");
        assertThat(decoded.count()).isZero();
    }

    @Test
    void missingTagFallsBackToExpectedType() {
        Sample decoded = serialization.fromWire(Map.of("name", "n", "secret", "s"), Sample.class);
        assertThat(decoded.name()).isEqualTo("n");
    }

    @Test
    void unknownTagIsRejected() {
        assertThatThrownBy(() -> serialization.fromWire(Map.of("serializer", "NOPE")))
                .isInstanceOfSatisfying(LedgerException.UnknownType.class,
                        e -> assertThat(e.tag()).isEqualTo("NOPE"));
    }

    @Test
    void missingRequiredFieldIsRejected() {
        assertThatThrownBy(() -> serialization.fromWire(Map.of("serializer", "SAMPLE", "name", "n"), Sample.class))
                .isInstanceOf(LedgerException.SchemaMismatch.class)
                .hasMessageContaining("secret");
    }

    @Test
    void wrongShapeIsRejected() {
        assertThatThrownBy(() -> serialization.fromWire(
                Map.of("serializer", "SAMPLE", "name", 12, "secret", "s"), Sample.class))
                .isInstanceOf(LedgerException.SchemaMismatch.class);
        assertThatThrownBy(() -> serialization.fromWire("not an object", Sample.class))
                .isInstanceOf(LedgerException.SchemaMismatch.class);
    }

    @Test
    void tagOfAnotherTypeIsRejected() {
        Map<String, Object> wire = serialization.toWire(new Tagged(List.of(), Map.of()));
        assertThatThrownBy(() -> serialization.fromWire(wire, Sample.class))
                .isInstanceOf(LedgerException.SchemaMismatch.class);
    }

    @Test
    void unregisteredTypeCannotBeWritten() {
        assertThatThrownBy(() -> serialization.toCanonicalBytes("plain string"))
                .isInstanceOf(LedgerException.UnknownType.class);
    }

    @Test
    void decodesArrays() {
        List<Object> wire = List.of(
                serialization.toWire(new Sample("a", 0, "s", null)),
                serialization.toWire(new Sample("b", 0, "s", null)));
        List<Sample> decoded = serialization.fromWireList(wire, Sample.class);
        assertThat(decoded).extracting(Sample::name).containsExactly("a", "b");
    }

    private static void raw(ByteArrayOutputStream out, String s) {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        int32(out, utf8.length);
        out.writeBytes(utf8);
    }

    private static void int32(ByteArrayOutputStream out, int v) {
        out.write(v >>> 24);
        out.write(v >>> 16);
        out.write(v >>> 8);
        out.write(v);
    }
}
