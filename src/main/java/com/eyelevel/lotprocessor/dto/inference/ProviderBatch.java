package com.eyelevel.lotprocessor.dto.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Batch object returned by the provider on creation and on every status poll.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderBatch(
        String id,
        String status,
        @JsonProperty("input_file_id") String inputFileId,
        @JsonProperty("output_file_id") String outputFileId,
        @JsonProperty("error_file_id") String errorFileId,
        @JsonProperty("request_counts") RequestCounts requestCounts,
        Map<String, String> metadata
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RequestCounts(int total, int completed, int failed) {
    }
}
