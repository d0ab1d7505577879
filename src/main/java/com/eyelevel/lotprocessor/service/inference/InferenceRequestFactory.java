package com.eyelevel.lotprocessor.service.inference;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.service.result.CustomIdCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the batch request lines for both inference phases.
 */
@Component
@RequiredArgsConstructor
public class InferenceRequestFactory {

    private static final String POST = "POST";

    private final LotProcessingConfig config;

    /**
     * One multimodal request per lot: the assessment prompt with the lot's additional info, followed by
     * every image as an {@code input_image} item.
     */
    public InferenceRequestLine visionRequest(BatchLot lot) {
        LotProcessingConfig.Inference inference = config.getInference();

        List<Map<String, Object>> content = new ArrayList<>();
        content.add(Map.of("type", "input_text", "text", visionPrompt(lot)));
        for (String imageUrl : lot.getImageUrls()) {
            content.add(Map.of("type", "input_image", "image_url", imageUrl));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", inference.getVisionModel());
        body.put("reasoning", Map.of("effort", inference.getReasoningEffort()));
        if (inference.getVisionSystemPrompt() != null && !inference.getVisionSystemPrompt().isBlank()) {
            body.put("instructions", inference.getVisionSystemPrompt());
        }
        body.put("input", List.of(Map.of("role", "user", "content", content)));
        body.put("max_output_tokens", inference.getMaxOutputTokens());

        return new InferenceRequestLine(CustomIdCodec.vision(lot.getLotId()), POST, inference.getEndpoint(), body);
    }

    /**
     * One text request per (lot, language) over the lot's English description.
     */
    public InferenceRequestLine translationRequest(String lotId, String englishText, String language) {
        LotProcessingConfig.Inference inference = config.getInference();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", inference.getTranslationModel());
        body.put("input", "Translate the following text into " + language
                          + " only. Maintain the original formatting and meaning:\n\n" + englishText);
        body.put("max_output_tokens", inference.getMaxOutputTokens());

        return new InferenceRequestLine(CustomIdCodec.translation(lotId, language), POST,
                                        inference.getEndpoint(), body);
    }

    private static String visionPrompt(BatchLot lot) {
        StringBuilder prompt = new StringBuilder("Analyze these car images and provide a detailed damage assessment.");
        if (lot.getAdditionalInfo() != null && !lot.getAdditionalInfo().isBlank()) {
            prompt.append("\n\nAdditional info: ").append(lot.getAdditionalInfo());
        }
        prompt.append("\n\nThe lot has ").append(lot.getImageUrls().size()).append(" image(s).");
        return prompt.toString();
    }
}
