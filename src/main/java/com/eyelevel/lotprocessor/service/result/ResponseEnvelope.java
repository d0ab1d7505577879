package com.eyelevel.lotprocessor.service.result;

import java.util.List;
import java.util.Optional;

/**
 * The response envelope of one batch result line, classified into exactly one known shape.
 * Only the content-bearing variants yield text.
 */
public sealed interface ResponseEnvelope permits ResponseEnvelope.StructuredOutput, ResponseEnvelope.ChatCompletion,
        ResponseEnvelope.PlainText, ResponseEnvelope.FormatMetadataOnly, ResponseEnvelope.ErrorResponse,
        ResponseEnvelope.Unrecognized {

    /**
     * @return The generated text, if this shape carries any.
     */
    Optional<String> extractText();

    /**
     * @return A short description of the shape, recorded on lots that yield no text.
     */
    String describeShape();

    /**
     * Responses API: {@code output[]} entry of type "message" whose content holds an "output_text" item.
     */
    record StructuredOutput(String text) implements ResponseEnvelope {
        @Override
        public Optional<String> extractText() {
            return Optional.of(text);
        }

        @Override
        public String describeShape() {
            return "structured_output";
        }
    }

    /**
     * Chat Completions API: {@code choices[0].message.content}.
     */
    record ChatCompletion(String text) implements ResponseEnvelope {
        @Override
        public Optional<String> extractText() {
            return Optional.of(text);
        }

        @Override
        public String describeShape() {
            return "chat_completion";
        }
    }

    /**
     * A plain string field such as {@code output_text}.
     */
    record PlainText(String field, String text) implements ResponseEnvelope {
        @Override
        public Optional<String> extractText() {
            return Optional.of(text);
        }

        @Override
        public String describeShape() {
            return "plain_text(" + field + ")";
        }
    }

    /**
     * The {@code text} field only carries response-format settings such as {@code {"format":{"type":"text"}}}.
     * It looks like content but is metadata, so it never yields text.
     */
    record FormatMetadataOnly(String formatType, List<String> bodyFields) implements ResponseEnvelope {
        @Override
        public Optional<String> extractText() {
            return Optional.empty();
        }

        @Override
        public String describeShape() {
            return "format_metadata_only(text.format.type=" + formatType + ", fields=" + bodyFields + ")";
        }
    }

    /**
     * The request failed at the provider.
     */
    record ErrorResponse(Integer statusCode, String code, String message) implements ResponseEnvelope {
        @Override
        public Optional<String> extractText() {
            return Optional.empty();
        }

        @Override
        public String describeShape() {
            return "error(status=" + statusCode + ", code=" + code + ", message=" + message + ")";
        }
    }

    /**
     * No known field yields text.
     */
    record Unrecognized(List<String> bodyFields) implements ResponseEnvelope {
        @Override
        public Optional<String> extractText() {
            return Optional.empty();
        }

        @Override
        public String describeShape() {
            return "unrecognized(fields=" + bodyFields + ")";
        }
    }
}
