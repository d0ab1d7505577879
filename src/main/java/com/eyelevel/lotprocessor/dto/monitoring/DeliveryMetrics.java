package com.eyelevel.lotprocessor.dto.monitoring;

import java.time.Instant;

/**
 * Webhook delivery figures over a trailing window.
 *
 * @param failed                     Deliveries that exhausted their attempts.
 * @param pending                    Deliveries that still have attempts left, regardless of age.
 * @param successRate                Delivered share of the window's deliveries, in percent.
 * @param averageRetries             Mean attempt count of delivered deliveries.
 * @param averageDeliveryTimeSeconds Mean time from creation to delivery.
 */
public record DeliveryMetrics(
        int periodHours,
        long totalWebhooks,
        long delivered,
        long failed,
        long pending,
        double successRate,
        double averageRetries,
        double averageDeliveryTimeSeconds,
        Instant metricsTimestamp
) {
}
