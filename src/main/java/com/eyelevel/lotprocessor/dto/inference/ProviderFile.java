package com.eyelevel.lotprocessor.dto.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * File object returned by the provider after an upload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderFile(String id, String filename, String purpose, Long bytes) {
}
