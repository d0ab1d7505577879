package com.eyelevel.lotprocessor.dto.monitoring;

/**
 * Delivery health of one webhook URL.
 *
 * @param totalAttempts Deliveries created for the URL.
 * @param failed        Deliveries that exhausted their attempts.
 * @param successRate   Delivered share, in percent.
 */
public record EndpointHealth(String webhookUrl, long totalAttempts, long successful, long failed,
                             double successRate) {
}
