package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff for webhook re-attempts: {@code min(baseDelay * 2^attemptCount, maxDelay)}.
 */
@Component
@RequiredArgsConstructor
public class BackoffPolicy {

    private static final int MAX_EXPONENT = 30;

    private final LotProcessingConfig config;

    /**
     * @param attemptCount Attempts made so far, including the one that just failed.
     * @return The delay before the next attempt.
     */
    public Duration delayAfter(int attemptCount) {
        LotProcessingConfig.Webhook webhook = config.getWebhook();
        int exponent = Math.max(0, Math.min(attemptCount, MAX_EXPONENT));
        long baseMillis = webhook.getBaseDelay().toMillis();
        long maxMillis = webhook.getMaxDelay().toMillis();
        long factor = 1L << exponent;
        if (baseMillis > maxMillis / factor) {
            return webhook.getMaxDelay();
        }
        return Duration.ofMillis(Math.min(baseMillis * factor, maxMillis));
    }
}
