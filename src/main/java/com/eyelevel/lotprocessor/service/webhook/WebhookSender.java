package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.common.apiclient.model.ApiResponse;
import com.eyelevel.lotprocessor.common.apiclient.webhook.WebhookApiClient;
import com.eyelevel.lotprocessor.exception.apiclient.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Performs a single delivery attempt and turns every outcome into a {@link DeliveryResult}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSender {

    private final WebhookApiClient webhookApiClient;

    public DeliveryResult send(final String url, final String payload, final String signature) {
        try {
            ApiResponse response = webhookApiClient.post(url, payload, signature);
            return DeliveryResult.delivered(response.getStatusCode(), response.getBodyAsString());
        } catch (ApiException e) {
            if (e.hasResponse()) {
                return DeliveryResult.failed(e.getStatusCode(), e.getResponseBody(), "HTTP " + e.getStatusCode());
            }
            return DeliveryResult.failed(null, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error posting webhook to {}", url, e);
            return DeliveryResult.failed(null, null, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
