package com.eyelevel.lotprocessor.service.retention;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.eyelevel.lotprocessor.repository.BatchJobRepository;
import com.eyelevel.lotprocessor.repository.BatchLotRepository;
import com.eyelevel.lotprocessor.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Purges terminal jobs that have not changed for longer than the retention period, together with their
 * lots and webhook deliveries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    static final int PURGE_CHUNK_SIZE = 500;

    private final BatchJobRepository batchJobRepository;
    private final BatchLotRepository batchLotRepository;
    private final WebhookDeliveryRepository webhookDeliveryRepository;
    private final LotProcessingConfig config;
    private final Clock clock;

    /**
     * Deletes one chunk of expired jobs. Deliveries and lots go first, then the jobs themselves.
     *
     * @return The number of jobs deleted.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int purgeExpiredJobs() {
        Instant threshold = clock.instant().minus(config.getRetention().getMaxAge());
        List<UUID> expired = batchJobRepository.findIdsByStatusInAndUpdatedAtBefore(
                JobStatus.RETAINABLE_TERMINAL, threshold, PageRequest.of(0, PURGE_CHUNK_SIZE));
        if (expired.isEmpty()) {
            log.debug("No jobs older than {} to purge", threshold);
            return 0;
        }

        int deliveries = webhookDeliveryRepository.deleteByJobIds(expired);
        int lots = batchLotRepository.deleteByJobIds(expired);
        int jobs = batchJobRepository.deleteByIds(expired);
        log.info("Retention purged {} job(s), {} lot(s) and {} webhook deliver{} last updated before {}", jobs, lots,
                 deliveries, deliveries == 1 ? "y" : "ies", threshold);
        return jobs;
    }
}
