package com.eyelevel.lotprocessor.scheduler;

import com.eyelevel.lotprocessor.service.reconcile.BatchReconciliationService;
import com.eyelevel.lotprocessor.service.retention.RetentionService;
import com.eyelevel.lotprocessor.service.webhook.WebhookDeliveryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchSchedulerLoopTest {

    private static final long RETENTION_INTERVAL_MS = 3_600_000L;

    @Mock
    private BatchReconciliationService reconciliationService;
    @Mock
    private WebhookDeliveryService webhookDeliveryService;
    @Mock
    private RetentionService retentionService;
    @Mock
    private Clock clock;

    private BatchSchedulerLoop loop;
    private Instant now;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2026-03-01T10:00:00Z");
        when(clock.instant()).thenAnswer(invocation -> now);
        loop = new BatchSchedulerLoop(reconciliationService, webhookDeliveryService, retentionService, clock,
                                      RETENTION_INTERVAL_MS);
    }

    @Test
    void runsStepsInOrder() {
        loop.tick();

        InOrder order = inOrder(reconciliationService, webhookDeliveryService, retentionService);
        order.verify(reconciliationService).reconcileActiveJobs();
        order.verify(webhookDeliveryService).processDueDeliveries();
        order.verify(retentionService).purgeExpiredJobs();
    }

    @Test
    void failingStepDoesNotSkipTheOthers() {
        when(reconciliationService.reconcileActiveJobs()).thenThrow(new IllegalStateException("db down"));
        when(webhookDeliveryService.processDueDeliveries()).thenThrow(new IllegalStateException("still down"));
        when(retentionService.purgeExpiredJobs()).thenThrow(new IllegalStateException("and again"));

        loop.tick();
        loop.tick();

        verify(reconciliationService, times(2)).reconcileActiveJobs();
        verify(webhookDeliveryService, times(2)).processDueDeliveries();
        verify(retentionService, times(1)).purgeExpiredJobs();
    }

    @Test
    void retentionRunsAtMostOncePerInterval() {
        loop.tick();
        now = now.plusSeconds(1800);
        loop.tick();
        verify(retentionService, times(1)).purgeExpiredJobs();

        now = now.plusSeconds(1800);
        loop.tick();
        verify(retentionService, times(2)).purgeExpiredJobs();
    }
}
