package io.atomledger.core.serialization;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeRegistryTest {

    record Thing(String value) {}

    private static TypeSchema<Thing> schema(String tag) {
        return TypeSchema.builder(tag, Thing.class)
                .field("value", ValueCodecs.STRING, Thing::value)
                .factory(v -> new Thing(v.get("value")))
                .build();
    }

    @Test
    void findsByTagAndType() {
        TypeSchema<Thing> thing = schema("THING");
        TypeRegistry registry = TypeRegistry.builder().register(thing).build();

        assertThat(registry.find("THING")).containsSame(thing);
        assertThat(registry.find(Thing.class)).containsSame(thing);
        assertThat(registry.find("OTHER")).isEmpty();
        assertThat(registry.find(String.class)).isEmpty();
        assertThat(registry.tags()).containsExactly("THING");
    }

    @Test
    void rejectsDuplicateTagOrType() {
        assertThatThrownBy(() -> TypeRegistry.builder().register(schema("THING")).register(schema("THING")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tag");
        assertThatThrownBy(() -> TypeRegistry.builder().register(schema("A")).register(schema("B")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("type");
    }

    @Test
    void schemaAppendsCanonicalVersionField() {
        TypeSchema<Thing> thing = schema("THING");
        assertThat(thing.fields()).extracting(FieldSchema::name).containsExactly("value", "version");
        FieldSchema<Thing, ?> version = thing.fields().get(1);
        assertThat(version.ordinal()).isEqualTo(1);
        assertThat(version.includedIn(Output.DSON)).isTrue();
        assertThat(version.includedIn(Output.WIRE)).isFalse();
    }

    @Test
    void schemaRejectsReservedNames() {
        assertThatThrownBy(() -> TypeSchema.builder("X", Thing.class)
                .field("serializer", ValueCodecs.STRING, Thing::value)
                .factory(v -> new Thing(""))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeSchema.builder("X", Thing.class)
                .field("version", ValueCodecs.STRING, Thing::value)
                .factory(v -> new Thing(""))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
