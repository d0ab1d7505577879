package com.eyelevel.lotprocessor.service.inference;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.model.BatchLot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceRequestFactoryTest {

    private final LotProcessingConfig config = new LotProcessingConfig();
    private final InferenceRequestFactory factory = new InferenceRequestFactory(config);

    @Test
    @SuppressWarnings("unchecked")
    void visionRequestCarriesEveryImage() {
        BatchLot lot = new BatchLot();
        lot.setLotId("L-9");
        lot.setAdditionalInfo("Front-end collision");
        lot.setImageUrls(List.of("https://img/1.jpg", "https://img/2.jpg"));

        InferenceRequestLine line = factory.visionRequest(lot);

        assertThat(line.customId()).isEqualTo("vision:L-9");
        assertThat(line.method()).isEqualTo("POST");
        assertThat(line.url()).isEqualTo("/v1/responses");
        assertThat(line.body()).containsEntry("model", "o4-mini")
                               .containsEntry("reasoning", Map.of("effort", "medium"))
                               .doesNotContainKey("instructions");

        List<Map<String, Object>> input = (List<Map<String, Object>>) line.body().get("input");
        List<Map<String, Object>> content = (List<Map<String, Object>>) input.get(0).get("content");
        assertThat(content).hasSize(3);
        assertThat(content.get(0).get("type")).isEqualTo("input_text");
        assertThat((String) content.get(0).get("text")).contains("Additional info: Front-end collision");
        assertThat(content.subList(1, 3)).extracting(item -> item.get("image_url"))
                                         .containsExactly("https://img/1.jpg", "https://img/2.jpg");
    }

    @Test
    void translationRequestTargetsOneLanguage() {
        config.getInference().setTranslationModel("gpt-4.1-mini");

        InferenceRequestLine line = factory.translationRequest("L-9", "Dented bumper.", "it");

        assertThat(line.customId()).isEqualTo("tr:L-9:it");
        assertThat(line.body()).containsEntry("model", "gpt-4.1-mini");
        assertThat((String) line.body().get("input")).contains("into it only").endsWith("Dented bumper.");
    }
}
