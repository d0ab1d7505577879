package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.dto.webhook.WebhookPayload;
import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.LotStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookPayloadBuilderTest {

    private final WebhookPayloadBuilder builder = new WebhookPayloadBuilder();

    @Test
    void englishFirstThenTargetsWithEnglishFallback() {
        BatchJob job = new BatchJob();
        job.setId(UUID.fromString("7f6d2c1e-0000-4000-8000-000000000001"));
        job.setLanguages(List.of("fr", "en", "de"));
        job.setCompletedAt(Instant.parse("2026-04-01T09:30:00Z"));

        BatchLot done = new BatchLot();
        done.setLotId("A");
        done.setStatus(LotStatus.COMPLETED);
        done.setVisionResult("Scratches on rear door.");
        done.setTranslations(Map.of("fr", "Rayures sur la porte arrière."));

        BatchLot failed = new BatchLot();
        failed.setLotId("B");
        failed.fail("no_images");

        WebhookPayload payload = builder.build(job, List.of(done, failed));

        assertThat(payload.jobId()).isEqualTo("7f6d2c1e-0000-4000-8000-000000000001");
        assertThat(payload.status()).isEqualTo("completed");
        assertThat(payload.completedAt()).isEqualTo("2026-04-01T09:30:00Z");
        assertThat(payload.signature()).isNull();

        WebhookPayload.LotResult first = payload.lots().get(0);
        assertThat(first.status()).isEqualTo("completed");
        assertThat(first.error()).isNull();
        assertThat(first.descriptions()).containsExactly(
                new WebhookPayload.Description("en", "<p>Scratches on rear door.</p>"),
                new WebhookPayload.Description("fr", "<p>Rayures sur la porte arrière.</p>"),
                new WebhookPayload.Description("de", "<p>Scratches on rear door.</p>"));

        WebhookPayload.LotResult second = payload.lots().get(1);
        assertThat(second.status()).isEqualTo("failed");
        assertThat(second.descriptions()).isEmpty();
        assertThat(second.error()).isEqualTo("no_images");
    }
}
