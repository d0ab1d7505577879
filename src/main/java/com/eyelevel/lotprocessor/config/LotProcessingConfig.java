package com.eyelevel.lotprocessor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. This provides centralized control over intake limits, inference
 * requests, webhook delivery and retention.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class LotProcessingConfig {

    private int maxLots = 50000;
    private Duration creationTimeBudget = Duration.ofSeconds(15);
    private String sharedKey;
    private Inference inference = new Inference();
    private Webhook webhook = new Webhook();
    private Retention retention = new Retention();
    private Security security = new Security();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Inference {
        private String endpoint = "/v1/responses";
        private String completionWindow = "24h";
        private String visionModel = "o4-mini";
        private String reasoningEffort = "medium";
        private String translationModel = "gpt-4.1-mini";
        private int maxOutputTokens = 2048;
        private String visionSystemPrompt;
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class Webhook {
        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofSeconds(30);
        private Duration maxDelay = Duration.ofMinutes(5);
        private Duration timeout = Duration.ofSeconds(10);
        private int batchSize = 100;
        private int responseBodyLimit = 1000;
        private int errorMessageLimit = 500;
        private boolean signatureInBody = false;
        private String userAgent = "Lot-Processor-Webhook/1.0";
    }

    @Data
    public static class Retention {
        private Duration maxAge = Duration.ofDays(7);
    }

    @Data
    public static class Security {
        private boolean requireSignature = true;
    }
}
