package com.eyelevel.lotprocessor.service.job;

import com.eyelevel.lotprocessor.exception.JobNotFoundException;
import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.BatchLot;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.eyelevel.lotprocessor.model.LotStatus;
import com.eyelevel.lotprocessor.repository.BatchJobRepository;
import com.eyelevel.lotprocessor.service.result.CustomId;
import com.eyelevel.lotprocessor.service.result.InferencePhase;
import com.eyelevel.lotprocessor.service.result.ResponseEnvelope;
import com.eyelevel.lotprocessor.service.webhook.WebhookDeliveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A centralized service for the state transitions of batch jobs.
 * Every method runs in its own {@code Propagation.REQUIRES_NEW} transaction scoped to one job, so each
 * transition commits immediately and atomically, and is guarded by the job's current status so that
 * applying it twice is harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleManager {

    static final String NO_RESULT_LINE = "no_result_line";
    static final String NO_TEXT_EXTRACTED = "no_text_extracted";

    private static final Set<JobStatus> FAILABLE_STATUSES = Set.of(JobStatus.PENDING, JobStatus.PROCESSING,
                                                                   JobStatus.TRANSLATING);

    private final BatchJobRepository batchJobRepository;
    private final WebhookDeliveryService webhookDeliveryService;
    private final Clock clock;

    /**
     * Persists a new job together with its lots.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BatchJob registerJob(final BatchJob job) {
        BatchJob saved = batchJobRepository.save(job);
        log.info("Registered job {} with {} lot(s) ({} rejected at intake), languages {}", saved.getId(),
                 saved.getTotalLots(), saved.getFailedLots(), saved.getLanguages());
        return saved;
    }

    /**
     * Records the vision batch and moves the job and its pending lots to {@code PROCESSING}.
     * A job cancelled in the meantime keeps its status but still records the batch reference.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markVisionSubmitted(final UUID jobId, final String batchRef) {
        BatchJob job = findJob(jobId);
        job.setVisionBatchRef(batchRef);
        if (job.getStatus() != JobStatus.PENDING) {
            log.warn("Job {} is {} after vision submission; batch {} recorded without a transition.", jobId,
                     job.getStatus(), batchRef);
            return;
        }
        job.setStatus(JobStatus.PROCESSING);
        job.getLots().stream()
           .filter(lot -> lot.getStatus() == LotStatus.PENDING)
           .forEach(lot -> lot.setStatus(LotStatus.PROCESSING));
        log.info("Job {} is PROCESSING with vision batch {}", jobId, batchRef);
    }

    /**
     * Marks a job {@code FAILED}. A no-op for jobs that are already failed or otherwise terminal.
     *
     * @return {@code true} if the job transitioned.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failJob(final UUID jobId, final String errorMessage) {
        BatchJob job = findJob(jobId);
        if (!FAILABLE_STATUSES.contains(job.getStatus())) {
            log.debug("Job {} is {}; not marking it FAILED ({})", jobId, job.getStatus(), errorMessage);
            return false;
        }
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(errorMessage);
        log.error("Job {} FAILED: {}", jobId, errorMessage);
        return true;
    }

    /**
     * Moves a {@code FAILED} job back into the phase whose remote batch turned out to have completed.
     *
     * @param target {@code PROCESSING} or {@code TRANSLATING}.
     * @return {@code true} if the job was recovered.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean recoverJob(final UUID jobId, final JobStatus target) {
        BatchJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.FAILED) {
            log.debug("Job {} is {}; nothing to recover", jobId, job.getStatus());
            return false;
        }
        String previousError = job.getErrorMessage();
        job.setStatus(target);
        job.setRetryCount(job.getRetryCount() + 1);
        job.setErrorMessage(null);
        log.warn("Recovered job {} from FAILED to {} (recovery #{}). Previous error: {}", jobId, target,
                 job.getRetryCount(), previousError);
        return true;
    }

    /**
     * Applies vision results to the job's in-flight lots. Completes the job, with its webhook deliveries,
     * when no translation phase is needed.
     *
     * @param envelopesByLotId Vision envelopes keyed by client lot id.
     * @param resultsPresent   Whether the result file held any decodable line.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public VisionOutcome applyVisionResults(final UUID jobId, final Map<String, ResponseEnvelope> envelopesByLotId,
                                            final boolean resultsPresent) {
        BatchJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.PROCESSING) {
            log.info("Job {} is {}; vision results not applied", jobId, job.getStatus());
            return VisionOutcome.skipped();
        }

        boolean translate = job.requiresTranslation();
        int withText = 0;
        int withoutText = 0;
        for (BatchLot lot : job.getLots()) {
            if (lot.getStatus() != LotStatus.PROCESSING) {
                continue;
            }
            ResponseEnvelope envelope = envelopesByLotId.get(lot.getLotId());
            if (envelope == null) {
                lot.fail(NO_RESULT_LINE);
                withoutText++;
                continue;
            }
            Optional<String> text = envelope.extractText();
            if (text.isPresent()) {
                lot.setVisionResult(text.get());
                lot.setErrorMessage(null);
                if (!translate) {
                    lot.setStatus(LotStatus.COMPLETED);
                }
                withText++;
            } else {
                lot.setVisionResult(null);
                lot.fail(NO_TEXT_EXTRACTED + ": " + envelope.describeShape());
                withoutText++;
            }
        }
        job.refreshCounters();
        log.info("Job {}: vision results applied, {} lot(s) with text, {} without", jobId, withText, withoutText);
        if (resultsPresent && withText == 0 && withoutText > 0) {
            log.error("Job {}: result file held lines but no lot yielded text. Probable response format mismatch.",
                      jobId);
        }

        List<VisionOutcome.TranslationWork> work = new ArrayList<>();
        if (translate) {
            for (BatchLot lot : job.getLots()) {
                if (lot.getStatus() == LotStatus.PROCESSING && lot.getVisionResult() != null) {
                    work.add(new VisionOutcome.TranslationWork(lot.getLotId(), lot.getVisionResult()));
                }
            }
        }
        if (work.isEmpty()) {
            completeJob(job);
            return VisionOutcome.completedJob();
        }
        return new VisionOutcome(true, false, work, job.getTargetLanguages());
    }

    /**
     * Records the translation batch and moves the job to {@code TRANSLATING}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markTranslationSubmitted(final UUID jobId, final String batchRef) {
        BatchJob job = findJob(jobId);
        job.setTranslationBatchRef(batchRef);
        if (job.getStatus() != JobStatus.PROCESSING) {
            log.warn("Job {} is {} after translation submission; batch {} recorded without a transition.", jobId,
                     job.getStatus(), batchRef);
            return;
        }
        job.setStatus(JobStatus.TRANSLATING);
        log.info("Job {} is TRANSLATING with batch {}", jobId, batchRef);
    }

    /**
     * Merges translation results into the lots and completes the job. Every target language ends up with an
     * entry: a missing or failed translation falls back to the English text and leaves a note on the lot.
     *
     * @param envelopes Translation envelopes keyed by decoded custom id.
     * @return {@code true} if the job completed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean applyTranslationResults(final UUID jobId, final Map<CustomId, ResponseEnvelope> envelopes) {
        BatchJob job = findJob(jobId);
        if (job.getStatus() != JobStatus.TRANSLATING) {
            log.info("Job {} is {}; translation results not applied", jobId, job.getStatus());
            return false;
        }

        List<String> languages = job.getTargetLanguages();
        int fallbacks = 0;
        for (BatchLot lot : job.getLots()) {
            if (lot.getStatus() != LotStatus.PROCESSING || lot.getVisionResult() == null) {
                continue;
            }
            Map<String, String> translations = new LinkedHashMap<>(lot.getTranslations());
            for (String language : languages) {
                ResponseEnvelope envelope = envelopes.get(new CustomId(InferencePhase.TRANSLATION, lot.getLotId(),
                                                                       language));
                Optional<String> text = envelope == null ? Optional.empty() : envelope.extractText();
                if (text.isPresent()) {
                    translations.put(language, text.get());
                } else {
                    translations.put(language, lot.getVisionResult());
                    lot.appendNote("translation_fallback[" + language + "]: "
                                   + (envelope == null ? NO_RESULT_LINE : envelope.describeShape()));
                    fallbacks++;
                }
            }
            lot.setTranslations(translations);
            lot.setStatus(LotStatus.COMPLETED);
        }
        if (fallbacks > 0) {
            log.warn("Job {}: {} translation(s) fell back to English", jobId, fallbacks);
        }
        completeJob(job);
        return true;
    }

    /**
     * Cancels a job that is still in flight and records the reason.
     *
     * @return {@code false} if the job's status does not allow cancellation.
     * @throws JobNotFoundException if the job does not exist.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancelJob(final UUID jobId, final String reason) {
        BatchJob job = findJob(jobId);
        if (!JobStatus.CANCELLABLE.contains(job.getStatus())) {
            log.warn("Job {} is {} and cannot be cancelled", jobId, job.getStatus());
            return false;
        }
        job.setStatus(JobStatus.CANCELLED);
        job.setErrorMessage(reason);
        log.info("Job {} CANCELLED: {}", jobId, reason);
        return true;
    }

    private void completeJob(final BatchJob job) {
        for (BatchLot lot : job.getLots()) {
            if (lot.getStatus() == LotStatus.PROCESSING || lot.getStatus() == LotStatus.PENDING) {
                if (lot.getVisionResult() != null) {
                    lot.setStatus(LotStatus.COMPLETED);
                } else {
                    lot.fail(NO_RESULT_LINE);
                }
            }
        }
        job.refreshCounters();
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(clock.instant());
        log.info("Job {} COMPLETED: {} processed, {} failed of {}", job.getId(), job.getProcessedLots(),
                 job.getFailedLots(), job.getTotalLots());
        webhookDeliveryService.createDeliveries(job);
    }

    private BatchJob findJob(final UUID jobId) {
        return batchJobRepository.findWithLotsById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
