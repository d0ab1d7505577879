package com.eyelevel.lotprocessor.service.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseEnvelopeClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseEnvelopeClassifier classifier = new ResponseEnvelopeClassifier();

    private ResponseEnvelope classify(String json) throws Exception {
        JsonNode node = objectMapper.readTree(json);
        return classifier.classify(node);
    }

    @Test
    void extractsStructuredOutputText() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":{"status_code":200,"body":{
                  "output":[
                    {"type":"reasoning","summary":[]},
                    {"type":"message","content":[{"type":"output_text","text":"Front bumper dented."}]}
                  ],
                  "text":{"format":{"type":"text"}}}}}
                """);

        assertThat(envelope).isInstanceOf(ResponseEnvelope.StructuredOutput.class);
        assertThat(envelope.extractText()).contains("Front bumper dented.");
    }

    @Test
    void extractsChatCompletionContent() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":{"status_code":200,"body":{
                  "choices":[{"message":{"role":"assistant","content":"Scratched door."}}]}}}
                """);

        assertThat(envelope).isInstanceOf(ResponseEnvelope.ChatCompletion.class);
        assertThat(envelope.extractText()).contains("Scratched door.");
    }

    @Test
    void extractsPlainOutputText() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"tr:1:fr","response":{"status_code":200,"body":{"output_text":"Porte rayée."}}}
                """);

        assertThat(envelope).isEqualTo(new ResponseEnvelope.PlainText("output_text", "Porte rayée."));
    }

    @Test
    void formatMetadataIsNotMistakenForContent() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":{"status_code":200,"body":{
                  "id":"resp_1","status":"incomplete","output":[{"type":"reasoning","summary":[]}],
                  "text":{"format":{"type":"text"}}}}}
                """);

        assertThat(envelope).isInstanceOf(ResponseEnvelope.FormatMetadataOnly.class);
        assertThat(envelope.extractText()).isEmpty();
        ResponseEnvelope.FormatMetadataOnly decoy = (ResponseEnvelope.FormatMetadataOnly) envelope;
        assertThat(decoy.formatType()).isEqualTo("text");
        assertThat(decoy.bodyFields()).containsExactly("id", "output", "status", "text");
        assertThat(envelope.describeShape()).startsWith("format_metadata_only(text.format.type=text");
    }

    @Test
    void blankTextFallsThroughToNextShape() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":{"status_code":200,"body":{
                  "output":[{"type":"message","content":[{"type":"output_text","text":"   "}]}],
                  "output_text":"fallback text"}}}
                """);

        assertThat(envelope.extractText()).contains("fallback text");
    }

    @Test
    void lineLevelErrorWins() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":null,
                 "error":{"code":"batch_expired","message":"This request could not be executed before the completion window expired."}}
                """);

        assertThat(envelope).isInstanceOf(ResponseEnvelope.ErrorResponse.class);
        ResponseEnvelope.ErrorResponse error = (ResponseEnvelope.ErrorResponse) envelope;
        assertThat(error.statusCode()).isNull();
        assertThat(error.code()).isEqualTo("batch_expired");
    }

    @Test
    void httpErrorStatusIsAnError() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":{"status_code":400,"body":{
                  "error":{"code":"invalid_image_url","message":"Could not download image."}}}}
                """);

        assertThat(envelope).isEqualTo(new ResponseEnvelope.ErrorResponse(400, "invalid_image_url",
                                                                          "Could not download image."));
        assertThat(envelope.extractText()).isEmpty();
    }

    @Test
    void unknownBodyIsUnrecognized() throws Exception {
        ResponseEnvelope envelope = classify("""
                {"custom_id":"vision:1","response":{"status_code":200,"body":{"usage":{},"id":"x"}}}
                """);

        assertThat(envelope).isEqualTo(new ResponseEnvelope.Unrecognized(List.of("id", "usage")));
    }
}
