package com.eyelevel.lotprocessor.service.job;

import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.dto.job.response.JobResultView;
import com.eyelevel.lotprocessor.dto.job.response.JobStatusSnapshot;
import com.eyelevel.lotprocessor.exception.JobNotFoundException;
import com.eyelevel.lotprocessor.exception.LotProcessingException;
import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.eyelevel.lotprocessor.model.LotStatus;
import com.eyelevel.lotprocessor.repository.BatchJobRepository;
import com.eyelevel.lotprocessor.service.inference.InferenceRequestFactory;
import com.eyelevel.lotprocessor.service.inference.InferenceRequestLine;
import com.eyelevel.lotprocessor.service.inference.RemoteInferenceGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The client-facing entry point of the batch lifecycle: creates jobs and submits their vision batch,
 * serves status and results, and cancels jobs. Remote progress is picked up later by the reconciliation pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchOrchestrationService {

    static final String NO_IMAGES = "no_images";
    static final String CREATION_TIME_BUDGET_EXCEEDED = "creation_time_budget_exceeded";
    static final String NO_VALID_LOTS = "No lots with images to process";
    static final int BUDGET_CHECK_INTERVAL = 100;
    static final int MAX_PAGE_SIZE = 100;

    private final BatchJobRepository batchJobRepository;
    private final JobLifecycleManager jobLifecycleManager;
    private final InferenceRequestFactory requestFactory;
    private final RemoteInferenceGateway inferenceGateway;
    private final LotProcessingConfig config;
    private final Clock clock;

    /**
     * Validates and stores a new job, then submits one vision request per lot with images. The job record
     * survives a failed submission as {@code FAILED}.
     *
     * @return The new job's id.
     * @throws LotProcessingException if the request is invalid.
     */
    public UUID createJob(final List<LotSubmission> lots, final List<String> languages, final String webhookUrl) {
        validate(lots, languages);

        Instant deadline = clock.instant().plus(config.getCreationTimeBudget());
        BatchJob job = new BatchJob();
        job.setLanguages(normalizeLanguages(languages));
        job.setWebhookUrl(blankToNull(webhookUrl));

        List<InferenceRequestLine> requests = new ArrayList<>();
        boolean budgetExceeded = false;
        for (int i = 0; i < lots.size(); i++) {
            if (!budgetExceeded && i > 0 && i % BUDGET_CHECK_INTERVAL == 0 && clock.instant().isAfter(deadline)) {
                budgetExceeded = true;
                log.warn("Creation time budget of {} exceeded after {} of {} lots. Remaining lots are failed.",
                         config.getCreationTimeBudget(), i, lots.size());
            }
            BatchLot lot = toLot(lots.get(i));
            if (budgetExceeded) {
                lot.fail(CREATION_TIME_BUDGET_EXCEEDED);
            } else if (lot.getImageUrls().isEmpty()) {
                lot.fail(NO_IMAGES);
            } else {
                requests.add(requestFactory.visionRequest(lot));
            }
            job.addLot(lot);
        }
        job.setTotalLots(lots.size());
        job.refreshCounters();

        UUID jobId = jobLifecycleManager.registerJob(job).getId();
        if (requests.isEmpty()) {
            jobLifecycleManager.failJob(jobId, NO_VALID_LOTS);
            return jobId;
        }

        try {
            String batchRef = inferenceGateway.submit(requests, "vision for job " + jobId);
            jobLifecycleManager.markVisionSubmitted(jobId, batchRef);
        } catch (Exception e) {
            log.error("Vision batch submission failed for job {}", jobId, e);
            jobLifecycleManager.failJob(jobId, "Batch submission failed: " + e.getMessage());
        }
        return jobId;
    }

    @Transactional(readOnly = true)
    public Optional<JobStatusSnapshot> getStatus(final UUID jobId) {
        return batchJobRepository.findById(jobId).map(JobStatusSnapshot::from);
    }

    @Transactional(readOnly = true)
    public Optional<JobResultView> getResults(final UUID jobId) {
        return batchJobRepository.findWithLotsById(jobId)
                                 .map(job -> new JobResultView(JobStatusSnapshot.from(job),
                                                               job.getLots().stream()
                                                                  .map(JobResultView.LotResultView::from)
                                                                  .toList()));
    }

    /**
     * @param status Optional status filter.
     * @param size   Page size, capped.
     */
    @Transactional(readOnly = true)
    public Page<JobStatusSnapshot> listJobs(final JobStatus status, final int page, final int size) {
        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(size, MAX_PAGE_SIZE)),
                                           Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<BatchJob> jobs = status == null ? batchJobRepository.findAll(pageable)
                                             : batchJobRepository.findByStatus(status, pageable);
        return jobs.map(JobStatusSnapshot::from);
    }

    /**
     * Cancels a job locally. The remote batch keeps running and its results are ignored.
     *
     * @return {@code false} if the job is no longer cancellable.
     * @throws JobNotFoundException if the job does not exist.
     */
    public boolean cancelJob(final UUID jobId, final String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? "Cancelled by client" : reason;
        return jobLifecycleManager.cancelJob(jobId, effectiveReason);
    }

    private void validate(final List<LotSubmission> lots, final List<String> languages) {
        if (CollectionUtils.isEmpty(lots)) {
            throw new LotProcessingException("At least one lot is required");
        }
        if (lots.size() > config.getMaxLots()) {
            throw new LotProcessingException("Too many lots: " + lots.size() + " (maximum " + config.getMaxLots() + ")");
        }
        if (CollectionUtils.isEmpty(languages) || languages.stream().allMatch(l -> l == null || l.isBlank())) {
            throw new LotProcessingException("At least one language is required");
        }
        Set<String> seen = new HashSet<>();
        for (LotSubmission lot : lots) {
            if (lot.lotId() == null || lot.lotId().isBlank()) {
                throw new LotProcessingException("Every lot requires a lot_id");
            }
            if (!seen.add(lot.lotId())) {
                throw new LotProcessingException("Duplicate lot_id in request: " + lot.lotId());
            }
        }
    }

    private static BatchLot toLot(final LotSubmission submission) {
        BatchLot lot = new BatchLot();
        lot.setLotId(submission.lotId());
        lot.setAdditionalInfo(submission.additionalInfo());
        lot.setWebhookUrl(blankToNull(submission.webhookUrl()));
        List<String> urls = new ArrayList<>();
        if (submission.imageUrls() != null) {
            submission.imageUrls().stream()
                      .filter(url -> url != null && !url.isBlank())
                      .map(String::trim)
                      .forEach(urls::add);
        }
        lot.setImageUrls(urls);
        lot.setStatus(LotStatus.PENDING);
        return lot;
    }

    private static List<String> normalizeLanguages(final List<String> languages) {
        List<String> normalized = new ArrayList<>();
        for (String language : languages) {
            if (language != null && !language.isBlank() && !normalized.contains(language.trim())) {
                normalized.add(language.trim());
            }
        }
        return normalized;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
