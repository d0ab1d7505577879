package com.eyelevel.lotprocessor.service.result;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CustomIdCodecTest {

    @Test
    void visionIdKeepsColonsInLotId() {
        String encoded = CustomIdCodec.vision("lot:42:a");

        assertThat(encoded).isEqualTo("vision:lot:42:a");
        assertThat(CustomIdCodec.decode(encoded))
                .contains(new CustomId(InferencePhase.VISION, "lot:42:a", null));
    }

    @Test
    void translationIdSplitsOnLastColon() {
        String encoded = CustomIdCodec.translation("lot:7", "pt-BR");

        assertThat(encoded).isEqualTo("tr:lot:7:pt-BR");
        assertThat(CustomIdCodec.decode(encoded))
                .contains(new CustomId(InferencePhase.TRANSLATION, "lot:7", "pt-BR"));
    }

    @Test
    void rejectsUnknownOrIncompleteIds() {
        assertThat(CustomIdCodec.decode(null)).isEmpty();
        assertThat(CustomIdCodec.decode("request-1")).isEmpty();
        assertThat(CustomIdCodec.decode("vision:")).isEmpty();
        assertThat(CustomIdCodec.decode("tr:lot-1")).isEmpty();
        assertThat(CustomIdCodec.decode("tr:lot-1:")).isEmpty();
        assertThat(CustomIdCodec.decode("tr::fr")).isEmpty();
    }
}
