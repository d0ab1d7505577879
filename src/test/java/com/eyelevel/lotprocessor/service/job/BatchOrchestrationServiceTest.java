package com.eyelevel.lotprocessor.service.job;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.exception.LotProcessingException;
import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.LotStatus;
import com.eyelevel.lotprocessor.repository.BatchJobRepository;
import com.eyelevel.lotprocessor.service.inference.InferenceRequestFactory;
import com.eyelevel.lotprocessor.service.inference.RemoteInferenceGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchOrchestrationServiceTest {

    @Mock
    private BatchJobRepository batchJobRepository;
    @Mock
    private JobLifecycleManager jobLifecycleManager;
    @Mock
    private RemoteInferenceGateway inferenceGateway;
    @Mock
    private Clock clock;

    private LotProcessingConfig config;
    private BatchOrchestrationService orchestrationService;
    private Instant now;
    private final UUID jobId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        config = new LotProcessingConfig();
        now = Instant.parse("2026-02-02T08:00:00Z");
        lenient().when(clock.instant()).thenAnswer(invocation -> now);
        lenient().when(jobLifecycleManager.registerJob(any(BatchJob.class))).thenAnswer(invocation -> {
            BatchJob job = invocation.getArgument(0);
            job.setId(jobId);
            return job;
        });
        orchestrationService = new BatchOrchestrationService(batchJobRepository, jobLifecycleManager,
                                                             new InferenceRequestFactory(config), inferenceGateway,
                                                             config, clock);
    }

    @Test
    void rejectsInvalidRequests() {
        List<String> en = List.of("en");
        LotSubmission lot = new LotSubmission("A", null, List.of("https://img/a.jpg"), null);

        assertThatThrownBy(() -> orchestrationService.createJob(List.of(), en, null))
                .isInstanceOf(LotProcessingException.class);
        assertThatThrownBy(() -> orchestrationService.createJob(List.of(lot), List.of(" "), null))
                .isInstanceOf(LotProcessingException.class)
                .hasMessageContaining("language");
        assertThatThrownBy(() -> orchestrationService.createJob(List.of(lot, lot), en, null))
                .isInstanceOf(LotProcessingException.class)
                .hasMessageContaining("Duplicate lot_id");

        config.setMaxLots(1);
        assertThatThrownBy(() -> orchestrationService.createJob(
                List.of(lot, new LotSubmission("B", null, List.of(), null)), en, null))
                .isInstanceOf(LotProcessingException.class)
                .hasMessageContaining("Too many lots");
        verifyNoInteractions(jobLifecycleManager, inferenceGateway);
    }

    @Test
    void lotsPastTheCreationBudgetFailWithoutSubmission() {
        config.setCreationTimeBudget(Duration.ofSeconds(1));
        List<LotSubmission> lots = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            lots.add(new LotSubmission("lot-" + i, null, List.of("https://img/" + i + ".jpg"), null));
        }
        when(inferenceGateway.submit(anyList(), anyString())).thenReturn("batch_1");
        when(clock.instant()).thenReturn(now, now, now.plusSeconds(5));

        orchestrationService.createJob(lots, List.of("en", "EN", "fr"), " ");

        ArgumentCaptor<BatchJob> registered = ArgumentCaptor.forClass(BatchJob.class);
        verify(jobLifecycleManager).registerJob(registered.capture());
        BatchJob job = registered.getValue();
        assertThat(job.getTotalLots()).isEqualTo(250);
        assertThat(job.getWebhookUrl()).isNull();
        assertThat(job.getLanguages()).containsExactly("en", "EN", "fr");
        assertThat(job.getTargetLanguages()).containsExactly("fr");

        List<BatchLot> stored = job.getLots();
        assertThat(stored.subList(0, 200)).allMatch(lot -> lot.getStatus() == LotStatus.PENDING);
        assertThat(stored.subList(200, 250)).allMatch(lot -> lot.getStatus() == LotStatus.FAILED
                                                             && "creation_time_budget_exceeded".equals(lot.getErrorMessage()));
        assertThat(job.getFailedLots()).isEqualTo(50);
        verify(inferenceGateway).submit(org.mockito.ArgumentMatchers.argThat(requests -> requests.size() == 200),
                                        anyString());
        verify(jobLifecycleManager).markVisionSubmitted(jobId, "batch_1");
    }

    @Test
    void jobWithoutImagesIsFailedInsteadOfSubmitted() {
        orchestrationService.createJob(List.of(new LotSubmission("A", null, List.of(" "), null)), List.of("en"),
                                       "https://client/hook");

        verify(jobLifecycleManager).failJob(jobId, BatchOrchestrationService.NO_VALID_LOTS);
        verify(inferenceGateway, never()).submit(anyList(), anyString());
    }

    @Test
    void blankCancelReasonGetsDefault() {
        when(jobLifecycleManager.cancelJob(jobId, "Cancelled by client")).thenReturn(true);

        assertThat(orchestrationService.cancelJob(jobId, "  ")).isTrue();
    }
}
