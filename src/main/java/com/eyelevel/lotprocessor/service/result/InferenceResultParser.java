package com.eyelevel.lotprocessor.service.result;

import com.eyelevel.lotprocessor.common.json.JsonParser;
import com.eyelevel.lotprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a downloaded JSONL result file into {@link InferenceResult}s. Lines that are not JSON or whose
 * {@code custom_id} cannot be decoded are skipped and counted, never fatal for the whole file.
 */
@Slf4j
@Component
public class InferenceResultParser {

    private final JsonParser jsonParser;
    private final ResponseEnvelopeClassifier classifier;

    public InferenceResultParser(@Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                 final ResponseEnvelopeClassifier classifier) {
        this.jsonParser = jsonParser;
        this.classifier = classifier;
    }

    public ParsedResults parse(final String jsonl) {
        final List<InferenceResult> results = new ArrayList<>();
        int skipped = 0;
        if (jsonl == null || jsonl.isBlank()) {
            return new ParsedResults(results, skipped);
        }

        int lineNumber = 0;
        for (String line : jsonl.split("\\r?\\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            final JsonNode node;
            try {
                node = jsonParser.parseTree(line);
            } catch (JsonParsingException e) {
                log.warn("Skipping malformed result line {}: {}", lineNumber, e.getMessage());
                skipped++;
                continue;
            }
            final String rawCustomId = node.path("custom_id").asText(null);
            final Optional<CustomId> customId = CustomIdCodec.decode(rawCustomId);
            if (customId.isEmpty()) {
                log.warn("Skipping result line {} with undecodable custom_id '{}'", lineNumber, rawCustomId);
                skipped++;
                continue;
            }
            results.add(new InferenceResult(customId.get(), classifier.classify(node)));
        }
        log.debug("Parsed {} result lines ({} skipped)", results.size(), skipped);
        return new ParsedResults(results, skipped);
    }

    /**
     * @param results      Decoded lines in file order.
     * @param skippedLines Lines that could not be decoded.
     */
    public record ParsedResults(List<InferenceResult> results, int skippedLines) {

        public boolean isEmpty() {
            return results.isEmpty();
        }
    }
}
