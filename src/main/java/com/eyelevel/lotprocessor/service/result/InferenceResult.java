package com.eyelevel.lotprocessor.service.result;

import java.util.Optional;

/**
 * One decoded result line.
 */
public record InferenceResult(CustomId customId, ResponseEnvelope envelope) {

    public Optional<String> text() {
        return envelope.extractText();
    }
}
