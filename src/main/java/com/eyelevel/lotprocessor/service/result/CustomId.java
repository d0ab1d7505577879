package com.eyelevel.lotprocessor.service.result;

/**
 * A decoded request correlation id.
 *
 * @param phase    The inference phase the request belongs to.
 * @param lotId    The client lot id.
 * @param language The target language for translation requests, {@code null} for vision requests.
 */
public record CustomId(InferencePhase phase, String lotId, String language) {
}
