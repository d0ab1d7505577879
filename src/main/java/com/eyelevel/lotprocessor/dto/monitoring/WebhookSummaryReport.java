package com.eyelevel.lotprocessor.dto.monitoring;

import java.time.Instant;
import java.util.List;

/**
 * @param healthScore  0 to 100, see {@code WebhookMonitoringService#getSummaryReport()}.
 * @param healthStatus healthy, degraded, unhealthy or critical.
 */
public record WebhookSummaryReport(
        DeliveryMetrics metrics24h,
        DeliveryMetrics metrics1h,
        List<FailedDelivery> failedWebhooks,
        List<EndpointHealth> endpointHealth,
        List<WebhookAlert> alerts,
        double healthScore,
        String healthStatus,
        Instant reportTimestamp
) {
}
