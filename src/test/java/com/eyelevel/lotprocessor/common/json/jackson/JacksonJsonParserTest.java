package com.eyelevel.lotprocessor.common.json.jackson;

import com.eyelevel.lotprocessor.dto.inference.ProviderFile;
import com.eyelevel.lotprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonParserTest {

    private final JacksonJsonParser parser = new JacksonJsonParser(new ObjectMapper());

    @Test
    void parsesResultLineIntoTree() {
        JsonNode node = parser.parseTree("{\"custom_id\":\"vision:A\",\"response\":{\"status_code\":200}}");

        assertThat(node.get("custom_id").asText()).isEqualTo("vision:A");
        assertThat(node.at("/response/status_code").asInt()).isEqualTo(200);
    }

    @Test
    void malformedLineRaisesParsingExceptionWithCause() {
        assertThatThrownBy(() -> parser.parseTree("{\"custom_id\":\"vision:A\","))
                .isInstanceOf(JsonParsingException.class)
                .hasMessage("Error parsing JSON tree")
                .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void emptyDocumentIsRejected() {
        assertThatThrownBy(() -> parser.parseTree("   "))
                .isInstanceOf(JsonParsingException.class)
                .hasMessage("JSON document is empty");
    }

    @Test
    void bindsProviderBodyIgnoringUnknownFields() {
        byte[] body = "{\"id\":\"file-1\",\"object\":\"file\",\"purpose\":\"batch\",\"bytes\":42}"
                .getBytes(StandardCharsets.UTF_8);

        ProviderFile file = parser.parseObject(body, ProviderFile.class);

        assertThat(file.id()).isEqualTo("file-1");
        assertThat(file.purpose()).isEqualTo("batch");
        assertThat(file.bytes()).isEqualTo(42L);
    }

    @Test
    void invalidProviderBodyRaisesParsingException() {
        assertThatThrownBy(() -> parser.parseObject("not json".getBytes(StandardCharsets.UTF_8), ProviderFile.class))
                .isInstanceOf(JsonParsingException.class)
                .hasMessage("Error parsing JSON into ProviderFile");
    }
}
