package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.common.json.JsonSerializer;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.dto.webhook.WebhookPayload;
import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.DeliveryStatus;
import com.eyelevel.lotprocessor.model.WebhookDelivery;
import com.eyelevel.lotprocessor.repository.WebhookDeliveryRepository;
import com.eyelevel.lotprocessor.service.signature.SignatureService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates webhook deliveries for completed jobs and drives their attempts.
 */
@Slf4j
@Service
public class WebhookDeliveryService {

    private static final Set<DeliveryStatus> RETRYABLE_STATUSES = Set.of(DeliveryStatus.PENDING, DeliveryStatus.FAILED);

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookPayloadBuilder payloadBuilder;
    private final SignatureService signatureService;
    private final JsonSerializer canonicalJsonSerializer;
    private final WebhookSender webhookSender;
    private final WebhookDeliveryStateManager stateManager;
    private final LotProcessingConfig config;
    private final Clock clock;

    public WebhookDeliveryService(final WebhookDeliveryRepository deliveryRepository,
                                  final WebhookPayloadBuilder payloadBuilder,
                                  final SignatureService signatureService,
                                  @Qualifier("canonicalJsonSerializer") final JsonSerializer canonicalJsonSerializer,
                                  final WebhookSender webhookSender,
                                  final WebhookDeliveryStateManager stateManager,
                                  final LotProcessingConfig config,
                                  final Clock clock) {
        this.deliveryRepository = deliveryRepository;
        this.payloadBuilder = payloadBuilder;
        this.signatureService = signatureService;
        this.canonicalJsonSerializer = canonicalJsonSerializer;
        this.webhookSender = webhookSender;
        this.stateManager = stateManager;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates one signed delivery per effective webhook URL: the lot's own URL when set, otherwise the job's.
     * Runs inside the transaction that completes the job, so completion and its deliveries commit together.
     * Does nothing if the job already has deliveries.
     *
     * @return The number of deliveries created.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int createDeliveries(final BatchJob job) {
        if (deliveryRepository.existsByJobId(job.getId())) {
            log.info("Deliveries for job {} already exist. Skipping creation.", job.getId());
            return 0;
        }

        Map<String, List<BatchLot>> lotsByUrl = new LinkedHashMap<>();
        int unrouted = 0;
        for (BatchLot lot : job.getLots()) {
            String url = effectiveUrl(lot, job);
            if (url == null) {
                unrouted++;
                continue;
            }
            lotsByUrl.computeIfAbsent(url, key -> new ArrayList<>()).add(lot);
        }
        if (unrouted > 0) {
            log.warn("Job {}: {} lot(s) have no webhook URL and will not be delivered", job.getId(), unrouted);
        }

        List<WebhookDelivery> deliveries = new ArrayList<>();
        lotsByUrl.forEach((url, lots) -> deliveries.add(newDelivery(job, url, lots)));
        deliveryRepository.saveAll(deliveries);
        log.info("Created {} webhook deliver{} for job {}", deliveries.size(),
                 deliveries.size() == 1 ? "y" : "ies", job.getId());
        return deliveries.size();
    }

    private WebhookDelivery newDelivery(final BatchJob job, final String url, final List<BatchLot> lots) {
        WebhookPayload payload = payloadBuilder.build(job, lots);
        String signature = signatureService.sign(payload);
        if (config.getWebhook().isSignatureInBody()) {
            payload = payload.withSignature(signature);
        }

        WebhookDelivery delivery = new WebhookDelivery();
        delivery.setJobId(job.getId());
        delivery.setWebhookUrl(url);
        delivery.setPayload(canonicalJsonSerializer.serialize(payload));
        delivery.setSignature(signature);
        delivery.setStatus(DeliveryStatus.PENDING);
        delivery.setNextAttemptAt(clock.instant());
        return delivery;
    }

    private static String effectiveUrl(final BatchLot lot, final BatchJob job) {
        if (lot.getWebhookUrl() != null && !lot.getWebhookUrl().isBlank()) {
            return lot.getWebhookUrl().trim();
        }
        if (job.getWebhookUrl() != null && !job.getWebhookUrl().isBlank()) {
            return job.getWebhookUrl().trim();
        }
        return null;
    }

    /**
     * Attempts every delivery that is due, up to the configured batch size. A failing attempt never stops
     * the others.
     *
     * @return The number of deliveries attempted.
     */
    public int processDueDeliveries() {
        LotProcessingConfig.Webhook webhook = config.getWebhook();
        List<Long> dueIds = deliveryRepository.findDueDeliveryIds(RETRYABLE_STATUSES, webhook.getMaxAttempts(),
                                                                  clock.instant(),
                                                                  PageRequest.of(0, webhook.getBatchSize()));
        if (dueIds.isEmpty()) {
            log.debug("No webhook deliveries due");
            return 0;
        }
        log.info("Attempting {} due webhook deliver{}", dueIds.size(), dueIds.size() == 1 ? "y" : "ies");
        int attempted = 0;
        for (Long deliveryId : dueIds) {
            try {
                attempt(deliveryId);
                attempted++;
            } catch (Exception e) {
                log.error("Error attempting webhook delivery {}. It stays due for the next run.", deliveryId, e);
            }
        }
        return attempted;
    }

    /**
     * Makes one attempt for a delivery. Delivered deliveries and deliveries without attempts left are
     * left untouched.
     *
     * @return The status after the attempt, or empty if the delivery does not exist.
     */
    public Optional<DeliveryStatus> attempt(final Long deliveryId) {
        Optional<WebhookDelivery> found = deliveryRepository.findById(deliveryId);
        if (found.isEmpty()) {
            log.warn("Webhook delivery {} not found", deliveryId);
            return Optional.empty();
        }
        WebhookDelivery delivery = found.get();
        if (delivery.getStatus() == DeliveryStatus.DELIVERED) {
            log.debug("Webhook delivery {} already delivered. Nothing to do.", deliveryId);
            return Optional.of(delivery.getStatus());
        }
        if (delivery.getAttemptCount() >= config.getWebhook().getMaxAttempts()) {
            log.debug("Webhook delivery {} has no attempts left", deliveryId);
            return Optional.of(delivery.getStatus());
        }

        log.debug("Posting webhook delivery {} to {} (attempt {})", deliveryId, delivery.getWebhookUrl(),
                  delivery.getAttemptCount() + 1);
        DeliveryResult result = webhookSender.send(delivery.getWebhookUrl(), delivery.getPayload(),
                                                   delivery.getSignature());
        return result.success()
               ? stateManager.recordSuccess(deliveryId, result)
               : stateManager.recordFailure(deliveryId, result);
    }
}
