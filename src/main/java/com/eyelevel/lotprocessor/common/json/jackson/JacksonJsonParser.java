package com.eyelevel.lotprocessor.common.json.jackson;

import com.eyelevel.lotprocessor.common.json.JsonParser;
import com.eyelevel.lotprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Implementation of the {@link JsonParser} interface backed by the application's {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        if (jsonBytes == null) {
            throw new JsonParsingException("Cannot parse null JSON into " + valueType.getSimpleName());
        }
        log.debug("Parsing JSON byte array ({} bytes) to object of type: {}", jsonBytes.length, valueType.getName());
        return parseJson(jsonBytes, valueType);
    }

    @Override
    public JsonNode parseTree(String json) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON into a tree");
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new JsonParsingException("JSON document is empty");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON document: {}", e.getOriginalMessage());
            throw new JsonParsingException("Error parsing JSON tree", e);
        }
    }

    @Override
    public <T> T treeToValue(JsonNode node, Class<T> valueType) {
        try {
            return objectMapper.treeToValue(node, valueType);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("JSON tree does not bind to {}: {}", valueType.getName(), e.getMessage());
            throw new JsonParsingException("Error binding JSON into " + valueType.getSimpleName(), e);
        }
    }

    /**
     * Generic method to handle all typed JSON parsing.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON into type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
