package com.eyelevel.lotprocessor.common.json.jackson;

import com.eyelevel.lotprocessor.common.json.JsonSerializer;
import com.eyelevel.lotprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Compact (single-line) serializer using the application's {@link ObjectMapper}. Used for JSONL request
 * lines sent to the inference provider.
 */
@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        log.trace("Serializing {} to JSON", object == null ? "null" : object.getClass().getName());
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
