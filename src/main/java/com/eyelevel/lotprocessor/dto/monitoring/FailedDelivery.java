package com.eyelevel.lotprocessor.dto.monitoring;

import com.eyelevel.lotprocessor.model.WebhookDelivery;

import java.time.Instant;
import java.util.UUID;

public record FailedDelivery(
        Long id,
        UUID jobId,
        String webhookUrl,
        int attemptCount,
        Integer responseStatus,
        String errorMessage,
        Instant lastAttempt,
        Instant createdAt
) {

    public static FailedDelivery from(WebhookDelivery delivery) {
        return new FailedDelivery(delivery.getId(), delivery.getJobId(), delivery.getWebhookUrl(),
                                  delivery.getAttemptCount(), delivery.getResponseStatus(),
                                  delivery.getErrorMessage(), delivery.getLastAttemptAt(), delivery.getCreatedAt());
    }
}
