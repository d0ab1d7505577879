package com.eyelevel.lotprocessor.service.webhook;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    private final LotProcessingConfig config = new LotProcessingConfig();
    private final BackoffPolicy backoffPolicy = new BackoffPolicy(config);

    @Test
    void doublesFromBaseDelayUntilCapped() {
        assertThat(backoffPolicy.delayAfter(0)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoffPolicy.delayAfter(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoffPolicy.delayAfter(2)).isEqualTo(Duration.ofSeconds(120));
        assertThat(backoffPolicy.delayAfter(3)).isEqualTo(Duration.ofSeconds(240));
        assertThat(backoffPolicy.delayAfter(4)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void largeAttemptCountsStayAtMaximum() {
        assertThat(backoffPolicy.delayAfter(63)).isEqualTo(Duration.ofMinutes(5));
        assertThat(backoffPolicy.delayAfter(Integer.MAX_VALUE)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void followsConfiguredDelays() {
        config.getWebhook().setBaseDelay(Duration.ofMillis(10));
        config.getWebhook().setMaxDelay(Duration.ofMillis(50));

        assertThat(backoffPolicy.delayAfter(1)).isEqualTo(Duration.ofMillis(20));
        assertThat(backoffPolicy.delayAfter(3)).isEqualTo(Duration.ofMillis(50));
    }
}
