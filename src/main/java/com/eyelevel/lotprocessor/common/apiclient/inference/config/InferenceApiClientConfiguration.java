package com.eyelevel.lotprocessor.common.apiclient.inference.config;

import com.eyelevel.lotprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.lotprocessor.common.apiclient.authentication.impl.BearerTokenAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient} and the {@link Authentication} used to talk to the batch
 * inference provider.
 */
@Slf4j
@Configuration
public class InferenceApiClientConfiguration {

    @Value("${app.inference-client.baseurl}")
    private String baseUrl;

    @Value("${app.inference-client.api-key:}")
    private String apiKey;

    @Value("${app.inference-client.max-in-memory-size-mb:256}")
    private int maxInMemorySizeMb;

    /**
     * Result files for large batches run into hundreds of megabytes, so the default codec buffer
     * limit is raised.
     *
     * @return A configured {@link WebClient} bean named "inferenceWebClient".
     */
    @Bean("inferenceWebClient")
    public WebClient inferenceWebClient() {
        log.info("Initializing inference WebClient with base URL: {}", baseUrl);
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                                                          .codecs(codecs -> codecs.defaultCodecs()
                                                                                  .maxInMemorySize(maxInMemorySizeMb * 1024 * 1024))
                                                          .build();
        return WebClient.builder()
                        .baseUrl(baseUrl)
                        .exchangeStrategies(strategies)
                        .build();
    }

    @Bean("inferenceAuthentication")
    public Authentication inferenceAuthentication() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Inference API key is not configured. Batch submissions will fail authentication.");
        }
        return new BearerTokenAuthentication(apiKey);
    }
}
