package com.eyelevel.lotprocessor.service.result;

import java.util.Optional;

/**
 * Encodes and decodes the {@code custom_id} that correlates batch requests with their result lines.
 * <ul>
 *     <li>{@code vision:<lotId>}: decoded by stripping the fixed prefix, so the lot id may contain ':'.</li>
 *     <li>{@code tr:<lotId>:<language>}: decoded by splitting on the last ':', as language codes never
 *     contain one.</li>
 * </ul>
 */
public final class CustomIdCodec {

    static final String VISION_PREFIX = "vision:";
    static final String TRANSLATION_PREFIX = "tr:";

    private CustomIdCodec() {
    }

    public static String vision(String lotId) {
        return VISION_PREFIX + lotId;
    }

    public static String translation(String lotId, String language) {
        return TRANSLATION_PREFIX + lotId + ":" + language;
    }

    public static Optional<CustomId> decode(String customId) {
        if (customId == null) {
            return Optional.empty();
        }
        if (customId.startsWith(VISION_PREFIX)) {
            String lotId = customId.substring(VISION_PREFIX.length());
            return lotId.isEmpty() ? Optional.empty() : Optional.of(new CustomId(InferencePhase.VISION, lotId, null));
        }
        if (customId.startsWith(TRANSLATION_PREFIX)) {
            String rest = customId.substring(TRANSLATION_PREFIX.length());
            int separator = rest.lastIndexOf(':');
            if (separator <= 0 || separator == rest.length() - 1) {
                return Optional.empty();
            }
            return Optional.of(new CustomId(InferencePhase.TRANSLATION, rest.substring(0, separator),
                                            rest.substring(separator + 1)));
        }
        return Optional.empty();
    }
}
