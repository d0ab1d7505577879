package com.eyelevel.lotprocessor.common.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalJsonSerializerTest {

    private final CanonicalJsonSerializer serializer = new CanonicalJsonSerializer();

    record Sample(String zeta, int alpha, List<String> middle) {
    }

    @Test
    void sortsMapKeysRecursivelyWithoutWhitespace() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("y", 2);
        inner.put("x", 1);
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", inner);
        value.put("a", List.of(3, "s"));

        assertThat(serializer.serialize(value)).isEqualTo("{\"a\":[3,\"s\"],\"b\":{\"x\":1,\"y\":2}}");
    }

    @Test
    void sortsRecordProperties() {
        assertThat(serializer.serialize(new Sample("z", 1, List.of())))
                .isEqualTo("{\"alpha\":1,\"middle\":[],\"zeta\":\"z\"}");
    }

    @Test
    void treesAreSortedLikeMaps() throws Exception {
        JsonNode tree = new ObjectMapper().readTree("[{\"lot_id\":\"1\",\"images\":[{\"url\":\"u\"}],\"additional_info\":null}]");

        assertThat(serializer.serialize(tree))
                .isEqualTo("[{\"additional_info\":null,\"images\":[{\"url\":\"u\"}],\"lot_id\":\"1\"}]");
    }

    @Test
    void escapesNonAsciiWithLowercaseHex() {
        Map<String, Object> value = Map.of("text", "Dégâts É 🚗", "ctl", "a\tb\u0001");

        assertThat(serializer.serialize(value))
                .isEqualTo("{\"ctl\":\"a\\tb\\u0001\",\"text\":\"D\\u00e9g\\u00e2ts \\u00c9 \\ud83d\\ude97\"}");
    }
}
