package com.eyelevel.lotprocessor.service.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One line of a batch input file.
 */
public record InferenceRequestLine(
        @JsonProperty("custom_id") String customId,
        String method,
        String url,
        Map<String, Object> body
) {
}
