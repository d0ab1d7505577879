package com.eyelevel.lotprocessor.dto.inference;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CreateBatchRequest(
        @JsonProperty("input_file_id") String inputFileId,
        String endpoint,
        @JsonProperty("completion_window") String completionWindow,
        Map<String, String> metadata
) {
}
