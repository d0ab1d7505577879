package com.eyelevel.lotprocessor.service.result;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classifies the response of one batch result line into a {@link ResponseEnvelope} variant.
 * <p>
 * Shapes are checked in priority order: provider error, structured output, chat completion,
 * plain string, format-metadata decoy, and finally unrecognized. Blank strings never count as text.
 */
@Component
public class ResponseEnvelopeClassifier {

    /**
     * @param line One parsed result line: {@code {"custom_id": .., "response": {"status_code": .., "body": ..}, "error": ..}}.
     */
    public ResponseEnvelope classify(JsonNode line) {
        JsonNode error = line.path("error");
        JsonNode response = line.path("response");
        Integer statusCode = response.hasNonNull("status_code") ? response.get("status_code").asInt() : null;

        if (error.isObject()) {
            return new ResponseEnvelope.ErrorResponse(statusCode, textOrNull(error.path("code")),
                                                      textOrNull(error.path("message")));
        }

        JsonNode body = response.path("body");
        if (statusCode != null && statusCode >= 400) {
            JsonNode bodyError = body.path("error");
            return new ResponseEnvelope.ErrorResponse(statusCode, textOrNull(bodyError.path("code")),
                                                      textOrNull(bodyError.path("message")));
        }
        if (!body.isObject()) {
            return new ResponseEnvelope.Unrecognized(response.isObject() ? fieldNames(response) : List.of());
        }

        String structured = structuredOutputText(body.path("output"));
        if (structured != null) {
            return new ResponseEnvelope.StructuredOutput(structured);
        }

        String chat = nonBlankText(body.path("choices").path(0).path("message").path("content"));
        if (chat != null) {
            return new ResponseEnvelope.ChatCompletion(chat);
        }

        String outputText = nonBlankText(body.path("output_text"));
        if (outputText != null) {
            return new ResponseEnvelope.PlainText("output_text", outputText);
        }
        String plain = nonBlankText(body.path("text"));
        if (plain != null) {
            return new ResponseEnvelope.PlainText("text", plain);
        }

        JsonNode textField = body.path("text");
        if (textField.isObject() && textField.has("format")) {
            return new ResponseEnvelope.FormatMetadataOnly(textOrNull(textField.path("format").path("type")),
                                                           fieldNames(body));
        }
        return new ResponseEnvelope.Unrecognized(fieldNames(body));
    }

    /**
     * Text of the first "output_text" item of the first "message" entry, or {@code null}.
     */
    private static String structuredOutputText(JsonNode output) {
        if (!output.isArray()) {
            return null;
        }
        for (JsonNode entry : output) {
            if (!"message".equals(entry.path("type").asText())) {
                continue;
            }
            for (JsonNode content : entry.path("content")) {
                if ("output_text".equals(content.path("type").asText())) {
                    return nonBlankText(content.path("text"));
                }
            }
            return null;
        }
        return null;
    }

    private static String nonBlankText(JsonNode node) {
        if (node.isTextual() && !node.asText().isBlank()) {
            return node.asText();
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        Collections.sort(names);
        return names;
    }
}
