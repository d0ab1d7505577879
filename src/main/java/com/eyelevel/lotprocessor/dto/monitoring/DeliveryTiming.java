package com.eyelevel.lotprocessor.dto.monitoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Creation and delivery time of one delivered webhook.
 */
public record DeliveryTiming(Instant createdAt, Instant deliveredAt) {

    public Duration elapsed() {
        return Duration.between(createdAt, deliveredAt);
    }
}
