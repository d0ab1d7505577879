package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.model.DeliveryStatus;
import com.eyelevel.lotprocessor.model.WebhookDelivery;
import com.eyelevel.lotprocessor.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Records the outcome of delivery attempts. Each method commits in its own transaction so one delivery's
 * bookkeeping never depends on another's.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeliveryStateManager {

    private final WebhookDeliveryRepository deliveryRepository;
    private final BackoffPolicy backoffPolicy;
    private final LotProcessingConfig config;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<DeliveryStatus> recordSuccess(final Long deliveryId, final DeliveryResult result) {
        return deliveryRepository.findById(deliveryId).map(delivery -> {
            Instant now = clock.instant();
            delivery.setStatus(DeliveryStatus.DELIVERED);
            delivery.setAttemptCount(delivery.getAttemptCount() + 1);
            delivery.setLastAttemptAt(now);
            delivery.setDeliveredAt(now);
            delivery.setNextAttemptAt(null);
            delivery.setResponseStatus(result.responseStatus());
            delivery.setResponseBody(truncate(result.responseBody(), config.getWebhook().getResponseBodyLimit()));
            delivery.setErrorMessage(null);
            log.info("Webhook delivery {} for job {} delivered to {} (HTTP {}, attempt {})", deliveryId,
                     delivery.getJobId(), delivery.getWebhookUrl(), result.responseStatus(),
                     delivery.getAttemptCount());
            return delivery.getStatus();
        });
    }

    /**
     * Counts the attempt and either schedules the next one or, once the maximum is reached, marks the
     * delivery permanently failed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<DeliveryStatus> recordFailure(final Long deliveryId, final DeliveryResult result) {
        return deliveryRepository.findById(deliveryId).map(delivery -> {
            LotProcessingConfig.Webhook webhook = config.getWebhook();
            Instant now = clock.instant();
            int attempts = delivery.getAttemptCount() + 1;
            delivery.setAttemptCount(attempts);
            delivery.setLastAttemptAt(now);
            if (result.responseStatus() != null) {
                delivery.setResponseStatus(result.responseStatus());
            }
            if (result.responseBody() != null && !result.responseBody().isEmpty()) {
                delivery.setResponseBody(truncate(result.responseBody(), webhook.getResponseBodyLimit()));
            }
            delivery.setErrorMessage(truncate(result.errorMessage(), webhook.getErrorMessageLimit()));

            if (attempts >= webhook.getMaxAttempts()) {
                delivery.setStatus(DeliveryStatus.FAILED);
                delivery.setNextAttemptAt(null);
                log.error("Webhook delivery {} for job {} to {} failed permanently after {} attempts: {}",
                          deliveryId, delivery.getJobId(), delivery.getWebhookUrl(), attempts,
                          result.errorMessage());
            } else {
                delivery.setStatus(DeliveryStatus.PENDING);
                delivery.setNextAttemptAt(now.plus(backoffPolicy.delayAfter(attempts)));
                log.warn("Webhook delivery {} for job {} to {} failed (attempt {}/{}): {}. Next attempt at {}",
                         deliveryId, delivery.getJobId(), delivery.getWebhookUrl(), attempts,
                         webhook.getMaxAttempts(), result.errorMessage(), delivery.getNextAttemptAt());
            }
            return delivery.getStatus();
        });
    }

    /**
     * Re-queues a permanently failed delivery with a fresh attempt budget.
     *
     * @return {@code false} when the delivery is not in a permanently failed state.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean requeue(final Long deliveryId) {
        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElse(null);
        if (delivery == null || delivery.getStatus() != DeliveryStatus.FAILED) {
            return false;
        }
        delivery.setStatus(DeliveryStatus.PENDING);
        delivery.setAttemptCount(0);
        delivery.setNextAttemptAt(clock.instant());
        log.info("Webhook delivery {} for job {} re-queued by manual retry", deliveryId, delivery.getJobId());
        return true;
    }

    static String truncate(final String value, final int limit) {
        if (value == null || value.length() <= limit) {
            return value;
        }
        return value.substring(0, limit);
    }
}
