package com.eyelevel.lotprocessor.service.monitoring;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.dto.monitoring.DeliveryMetrics;
import com.eyelevel.lotprocessor.dto.monitoring.DeliveryTiming;
import com.eyelevel.lotprocessor.dto.monitoring.EndpointHealth;
import com.eyelevel.lotprocessor.dto.monitoring.EndpointStats;
import com.eyelevel.lotprocessor.dto.monitoring.FailedDelivery;
import com.eyelevel.lotprocessor.dto.monitoring.WebhookAlert;
import com.eyelevel.lotprocessor.dto.monitoring.WebhookSummaryReport;
import com.eyelevel.lotprocessor.exception.JobNotFoundException;
import com.eyelevel.lotprocessor.exception.JobStateConflictException;
import com.eyelevel.lotprocessor.model.DeliveryStatus;
import com.eyelevel.lotprocessor.repository.WebhookDeliveryRepository;
import com.eyelevel.lotprocessor.service.webhook.WebhookDeliveryStateManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Read-side view of the webhook delivery system: metrics, failures, endpoint health, alerts and an overall
 * health score. Also re-queues permanently failed deliveries on request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookMonitoringService {

    static final int ALERT_MIN_VOLUME = 10;
    static final double ALERT_SUCCESS_RATE = 90.0;
    static final int ALERT_STUCK_PENDING = 10;
    static final double ALERT_AVERAGE_RETRIES = 2.0;
    static final int ALERT_WORST_ENDPOINTS = 3;
    static final int ALERT_ENDPOINT_MIN_ATTEMPTS = 5;
    static final double ALERT_ENDPOINT_SUCCESS_RATE = 50.0;

    private static final Set<DeliveryStatus> OPEN_STATUSES = Set.of(DeliveryStatus.PENDING, DeliveryStatus.FAILED);

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDeliveryStateManager stateManager;
    private final LotProcessingConfig config;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DeliveryMetrics getDeliveryMetrics(final int hours) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofHours(hours));
        int maxAttempts = config.getWebhook().getMaxAttempts();

        long total = deliveryRepository.countByCreatedAtGreaterThanEqual(since);
        long delivered = deliveryRepository.countByStatusAndCreatedAtGreaterThanEqual(DeliveryStatus.DELIVERED, since);
        long failed = deliveryRepository.countByStatusAndAttemptCountGreaterThanEqualAndCreatedAtGreaterThanEqual(
                DeliveryStatus.FAILED, maxAttempts, since);
        long pending = deliveryRepository.countByStatusInAndAttemptCountLessThan(OPEN_STATUSES, maxAttempts);
        Double averageRetries = deliveryRepository.averageAttemptCountSince(DeliveryStatus.DELIVERED, since);

        List<DeliveryTiming> timings = deliveryRepository.findDeliveryTimingsSince(DeliveryStatus.DELIVERED, since);
        double averageDeliverySeconds = timings.stream()
                                               .mapToDouble(timing -> timing.elapsed().toMillis() / 1000.0)
                                               .average()
                                               .orElse(0.0);

        double successRate = total > 0 ? delivered * 100.0 / total : 0.0;
        return new DeliveryMetrics(hours, total, delivered, failed, pending, round2(successRate),
                                   round2(averageRetries == null ? 0.0 : averageRetries),
                                   round2(averageDeliverySeconds), now);
    }

    /**
     * @return Deliveries that exhausted their attempts, most recently attempted first.
     */
    @Transactional(readOnly = true)
    public List<FailedDelivery> getFailedDeliveries(final int limit) {
        return deliveryRepository.findByStatusAndAttemptCountGreaterThanEqualOrderByLastAttemptAtDesc(
                                         DeliveryStatus.FAILED, config.getWebhook().getMaxAttempts(),
                                         PageRequest.of(0, Math.max(1, limit)))
                                 .stream()
                                 .map(FailedDelivery::from)
                                 .toList();
    }

    /**
     * @return Per-URL health, worst success rate first.
     */
    @Transactional(readOnly = true)
    public List<EndpointHealth> getEndpointHealth() {
        List<EndpointStats> stats = deliveryRepository.aggregateByEndpoint(DeliveryStatus.DELIVERED,
                                                                           DeliveryStatus.FAILED,
                                                                           config.getWebhook().getMaxAttempts());
        List<EndpointHealth> health = new ArrayList<>(stats.size());
        for (EndpointStats stat : stats) {
            long total = stat.total() == null ? 0 : stat.total();
            long delivered = stat.delivered() == null ? 0 : stat.delivered();
            long failed = stat.failed() == null ? 0 : stat.failed();
            double successRate = total > 0 ? delivered * 100.0 / total : 0.0;
            health.add(new EndpointHealth(stat.webhookUrl(), total, delivered, failed, round2(successRate)));
        }
        health.sort(Comparator.comparingDouble(EndpointHealth::successRate));
        return health;
    }

    @Transactional(readOnly = true)
    public List<WebhookAlert> checkAlerts() {
        List<WebhookAlert> alerts = new ArrayList<>();

        DeliveryMetrics lastHour = getDeliveryMetrics(1);
        if (lastHour.totalWebhooks() > ALERT_MIN_VOLUME && lastHour.successRate() < ALERT_SUCCESS_RATE) {
            alerts.add(new WebhookAlert(WebhookAlert.Level.WARNING,
                                        "Webhook success rate is " + lastHour.successRate() + "% in the last hour",
                                        "success_rate", lastHour.successRate(), null));
        }

        long stuck = deliveryRepository.countByStatusAndCreatedAtBefore(DeliveryStatus.PENDING,
                                                                        clock.instant().minus(Duration.ofHours(1)));
        if (stuck > ALERT_STUCK_PENDING) {
            alerts.add(new WebhookAlert(WebhookAlert.Level.ERROR,
                                        stuck + " webhooks have been pending for over 1 hour",
                                        "stuck_webhooks", (double) stuck, null));
        }

        if (lastHour.averageRetries() > ALERT_AVERAGE_RETRIES) {
            alerts.add(new WebhookAlert(WebhookAlert.Level.WARNING,
                                        "Average retry count is " + lastHour.averageRetries() + " in the last hour",
                                        "retry_rate", lastHour.averageRetries(), null));
        }

        getEndpointHealth().stream()
                           .limit(ALERT_WORST_ENDPOINTS)
                           .filter(endpoint -> endpoint.totalAttempts() > ALERT_ENDPOINT_MIN_ATTEMPTS
                                               && endpoint.successRate() < ALERT_ENDPOINT_SUCCESS_RATE)
                           .forEach(endpoint -> alerts.add(new WebhookAlert(
                                   WebhookAlert.Level.ERROR,
                                   "Webhook endpoint " + endpoint.webhookUrl() + " has " + endpoint.successRate()
                                   + "% success rate",
                                   "endpoint_failure", endpoint.successRate(), endpoint.webhookUrl())));

        if (!alerts.isEmpty()) {
            log.warn("Webhook monitoring raised {} alert(s)", alerts.size());
        }
        return alerts;
    }

    /**
     * Combines the other views into one report with a health score. The score starts at 100 and loses
     * points for a 24-hour success rate under 95% (at most 20), for average retries over 1.5 (at most 15),
     * and 10 per error alert and 5 per warning alert.
     * A window without deliveries costs no points.
     */
    @Transactional(readOnly = true)
    public WebhookSummaryReport getSummaryReport() {
        DeliveryMetrics metrics24h = getDeliveryMetrics(24);
        DeliveryMetrics metrics1h = getDeliveryMetrics(1);
        List<WebhookAlert> alerts = checkAlerts();
        List<EndpointHealth> endpoints = getEndpointHealth();

        double score = healthScore(metrics24h, alerts);
        return new WebhookSummaryReport(metrics24h, metrics1h, getFailedDeliveries(5),
                                        endpoints.subList(0, Math.min(10, endpoints.size())), alerts, score,
                                        healthStatus(score), clock.instant());
    }

    static double healthScore(final DeliveryMetrics metrics24h, final List<WebhookAlert> alerts) {
        double score = 100.0;
        if (metrics24h.totalWebhooks() > 0 && metrics24h.successRate() < 95.0) {
            score -= Math.min(20.0, (95.0 - metrics24h.successRate()) * 2);
        }
        if (metrics24h.averageRetries() > 1.5) {
            score -= Math.min(15.0, (metrics24h.averageRetries() - 1.5) * 10);
        }
        for (WebhookAlert alert : alerts) {
            score -= alert.level() == WebhookAlert.Level.ERROR ? 10 : 5;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    static String healthStatus(final double score) {
        if (score >= 90) {
            return "healthy";
        }
        if (score >= 70) {
            return "degraded";
        }
        if (score >= 50) {
            return "unhealthy";
        }
        return "critical";
    }

    /**
     * Gives a permanently failed delivery a fresh set of attempts, starting now.
     *
     * @throws JobNotFoundException      if the delivery does not exist.
     * @throws JobStateConflictException if the delivery is not permanently failed.
     */
    public void retryDelivery(final Long deliveryId) {
        if (!deliveryRepository.existsById(deliveryId)) {
            throw new JobNotFoundException("Webhook delivery not found: " + deliveryId);
        }
        if (!stateManager.requeue(deliveryId)) {
            throw new JobStateConflictException("Webhook delivery " + deliveryId + " is not in a failed state");
        }
    }

    private static double round2(final double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
