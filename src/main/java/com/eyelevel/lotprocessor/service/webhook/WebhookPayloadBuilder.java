package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.dto.webhook.WebhookPayload;
import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.LotStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the completion payload for one webhook URL out of the lots routed to it.
 */
@Component
public class WebhookPayloadBuilder {

    static final String COMPLETED = "completed";

    public WebhookPayload build(BatchJob job, List<BatchLot> lots) {
        List<WebhookPayload.LotResult> results = new ArrayList<>(lots.size());
        List<String> targetLanguages = job.getTargetLanguages();
        for (BatchLot lot : lots) {
            results.add(toLotResult(lot, targetLanguages));
        }
        String completedAt = job.getCompletedAt() == null ? null : job.getCompletedAt().toString();
        return new WebhookPayload(job.getId().toString(), COMPLETED, completedAt, results, null);
    }

    private static WebhookPayload.LotResult toLotResult(BatchLot lot, List<String> targetLanguages) {
        String status = lot.getStatus().name().toLowerCase(Locale.ROOT);
        if (lot.getStatus() != LotStatus.COMPLETED || lot.getVisionResult() == null) {
            return new WebhookPayload.LotResult(lot.getLotId(), status, List.of(), lot.getMissingImages(),
                                                lot.getErrorMessage());
        }

        List<WebhookPayload.Description> descriptions = new ArrayList<>();
        descriptions.add(new WebhookPayload.Description(BatchJob.SOURCE_LANGUAGE, paragraph(lot.getVisionResult())));
        for (String language : targetLanguages) {
            String translated = lot.getTranslations().getOrDefault(language, lot.getVisionResult());
            descriptions.add(new WebhookPayload.Description(language, paragraph(translated)));
        }
        return new WebhookPayload.LotResult(lot.getLotId(), status, descriptions, lot.getMissingImages(), null);
    }

    private static String paragraph(String text) {
        return "<p>" + text + "</p>";
    }
}
