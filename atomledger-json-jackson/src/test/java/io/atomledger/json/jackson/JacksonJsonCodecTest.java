package io.atomledger.json.jackson;

import io.atomledger.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void readsIntegersAsLong() throws Exception {
        Map<?, ?> map = codec.readValue("{\"small\":1,\"big\":123456789012}", Map.class);

        assertThat(map.get("small")).isEqualTo(1L);
        assertThat(map.get("big")).isEqualTo(123456789012L);
    }

    @Test
    void writesTreesInInsertionOrder() throws Exception {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("serializer", "ATOM");
        tree.put("particles", List.of(Map.of("amount", ":u:10")));
        tree.put("flag", true);

        String json = codec.writeString(tree);

        assertThat(json).isEqualTo("{\"serializer\":\"ATOM\",\"particles\":[{\"amount\":\":u:10\"}],\"flag\":true}");
    }

    @Test
    void readsNestedTrees() throws Exception {
        @SuppressWarnings("unchecked")
        List<Object> list = codec.readValue("[\"a\",{\"b\":false},7]", List.class);

        assertThat(list).containsExactly("a", Map.of("b", false), 7L);
    }

    @Test
    void wrapsParseFailures() {
        assertThatThrownBy(() -> codec.readValue("{not json", Map.class))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining("java.util.Map");
    }
}
