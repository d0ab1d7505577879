package com.eyelevel.lotprocessor.service.retention;

import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.DeliveryStatus;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.eyelevel.lotprocessor.model.WebhookDelivery;
import com.eyelevel.lotprocessor.repository.BatchJobRepository;
import com.eyelevel.lotprocessor.repository.BatchLotRepository;
import com.eyelevel.lotprocessor.repository.WebhookDeliveryRepository;
import com.eyelevel.lotprocessor.service.inference.RemoteInferenceGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@SpringBootTest
class RetentionServiceTest {

    @MockBean
    private Clock clock;
    @MockBean
    private RemoteInferenceGateway inferenceGateway;

    @Autowired
    private RetentionService retentionService;
    @Autowired
    private BatchJobRepository batchJobRepository;
    @Autowired
    private BatchLotRepository batchLotRepository;
    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @AfterEach
    void cleanUp() {
        deliveryRepository.deleteAll();
        batchJobRepository.deleteAll();
    }

    @Test
    void purgesOnlyExpiredTerminalJobsWithTheirLotsAndDeliveries() {
        UUID completed = saveJob(JobStatus.COMPLETED, "C");
        UUID failed = saveJob(JobStatus.FAILED, "F");
        UUID cancelled = saveJob(JobStatus.CANCELLED, "X");
        UUID processing = saveJob(JobStatus.PROCESSING, "P");
        saveDelivery(completed);

        when(clock.instant()).thenReturn(Instant.now().plus(Duration.ofDays(8)));

        assertThat(retentionService.purgeExpiredJobs()).isEqualTo(3);

        assertThat(batchJobRepository.findAllById(List.of(completed, failed, cancelled))).isEmpty();
        assertThat(batchJobRepository.findById(processing)).isPresent();
        assertThat(batchLotRepository.findByJobIdOrderByPositionAsc(completed)).isEmpty();
        assertThat(batchLotRepository.findByJobIdOrderByPositionAsc(processing)).hasSize(1);
        assertThat(deliveryRepository.existsByJobId(completed)).isFalse();
    }

    @Test
    void keepsRecentJobs() {
        UUID completed = saveJob(JobStatus.COMPLETED, "C");
        when(clock.instant()).thenReturn(Instant.now().plus(Duration.ofDays(6)));

        assertThat(retentionService.purgeExpiredJobs()).isZero();
        assertThat(batchJobRepository.findById(completed)).isPresent();
    }

    private UUID saveJob(JobStatus status, String lotId) {
        BatchJob job = new BatchJob();
        job.setStatus(status);
        job.setLanguages(List.of("en"));
        BatchLot lot = new BatchLot();
        lot.setLotId(lotId);
        lot.setImageUrls(List.of("https://img/" + lotId + ".jpg"));
        job.addLot(lot);
        job.setTotalLots(1);
        return batchJobRepository.save(job).getId();
    }

    private void saveDelivery(UUID jobId) {
        WebhookDelivery delivery = new WebhookDelivery();
        delivery.setJobId(jobId);
        delivery.setWebhookUrl("https://client/hook");
        delivery.setPayload("{}");
        delivery.setSignature("sig");
        delivery.setStatus(DeliveryStatus.DELIVERED);
        deliveryRepository.save(delivery);
    }
}
