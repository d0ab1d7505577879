package com.eyelevel.lotprocessor.service.result;

import com.eyelevel.lotprocessor.common.json.jackson.JacksonJsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceResultParserTest {

    private final InferenceResultParser parser = new InferenceResultParser(new JacksonJsonParser(new ObjectMapper()),
                                                                           new ResponseEnvelopeClassifier());

    @Test
    void parsesLinesAndSkipsUndecodableOnes() {
        String jsonl = String.join("\n",
                "{\"custom_id\":\"vision:A\",\"response\":{\"status_code\":200,\"body\":{\"output_text\":\"ok\"}}}",
                "",
                "not json",
                "{\"custom_id\":\"something-else\",\"response\":{}}",
                "{\"custom_id\":\"tr:A:de\",\"response\":{\"status_code\":200,\"body\":{\"output_text\":\"gut\"}}}\r");

        InferenceResultParser.ParsedResults parsed = parser.parse(jsonl);

        assertThat(parsed.skippedLines()).isEqualTo(2);
        assertThat(parsed.results()).hasSize(2);
        assertThat(parsed.results().get(0).customId()).isEqualTo(new CustomId(InferencePhase.VISION, "A", null));
        assertThat(parsed.results().get(0).text()).contains("ok");
        assertThat(parsed.results().get(1).customId())
                .isEqualTo(new CustomId(InferencePhase.TRANSLATION, "A", "de"));
        assertThat(parsed.results().get(1).text()).contains("gut");
    }

    @Test
    void emptyInputYieldsNothing() {
        assertThat(parser.parse(null).isEmpty()).isTrue();
        assertThat(parser.parse("  \n").isEmpty()).isTrue();
    }
}
