package com.eyelevel.lotprocessor.common.apiclient.webhook.config;

import com.eyelevel.lotprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Configures the {@link WebClient} used for webhook deliveries. Deliveries target arbitrary client URLs,
 * so the client has no base URL and every request carries an absolute URL.
 */
@Slf4j
@Configuration
public class WebhookApiClientConfiguration {

    @Bean("webhookWebClient")
    public WebClient webhookWebClient() {
        log.info("Initializing webhook WebClient");
        return WebClient.builder().build();
    }

    @Bean("webhookHeaderConfig")
    public HeaderConfig webhookHeaderConfig(final LotProcessingConfig config) {
        return HeaderConfig.of(Map.of(HttpHeaders.USER_AGENT, config.getWebhook().getUserAgent()));
    }
}
