package com.eyelevel.lotprocessor.scheduler;

import com.eyelevel.lotprocessor.service.reconcile.BatchReconciliationService;
import com.eyelevel.lotprocessor.service.retention.RetentionService;
import com.eyelevel.lotprocessor.service.webhook.WebhookDeliveryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single periodic driver of the background work. Each tick reconciles jobs with the remote batches,
 * attempts due webhook deliveries and, at most once per retention interval, purges expired jobs.
 * Every step is isolated so a failing step never skips the others or stops the loop.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchSchedulerLoop {

    private final BatchReconciliationService reconciliationService;
    private final WebhookDeliveryService webhookDeliveryService;
    private final RetentionService retentionService;
    private final Clock clock;
    private final Duration retentionInterval;

    private Instant lastRetentionRun;

    public BatchSchedulerLoop(final BatchReconciliationService reconciliationService,
                              final WebhookDeliveryService webhookDeliveryService,
                              final RetentionService retentionService,
                              final Clock clock,
                              @Value("${app.scheduler.retention-interval-ms:3600000}") final long retentionIntervalMs) {
        this.reconciliationService = reconciliationService;
        this.webhookDeliveryService = webhookDeliveryService;
        this.retentionService = retentionService;
        this.clock = clock;
        this.retentionInterval = Duration.ofMillis(retentionIntervalMs);
    }

    @Scheduled(fixedDelayString = "${app.scheduler.tick-interval-ms:30000}",
               initialDelayString = "${app.scheduler.initial-delay-ms:10000}")
    public void tick() {
        log.debug("Scheduler tick started");
        try {
            reconciliationService.reconcileActiveJobs();
        } catch (Exception e) {
            log.error("Job reconciliation step failed. It will run again on the next tick.", e);
        }

        try {
            webhookDeliveryService.processDueDeliveries();
        } catch (Exception e) {
            log.error("Webhook delivery step failed. It will run again on the next tick.", e);
        }

        runRetentionIfDue();
        log.debug("Scheduler tick finished");
    }

    void runRetentionIfDue() {
        Instant now = clock.instant();
        if (lastRetentionRun != null && now.isBefore(lastRetentionRun.plus(retentionInterval))) {
            return;
        }
        lastRetentionRun = now;
        try {
            int purged = retentionService.purgeExpiredJobs();
            log.info("Retention run finished, {} job(s) purged", purged);
        } catch (Exception e) {
            log.error("Retention step failed. It will run again after the next interval.", e);
        }
    }
}
