package com.eyelevel.lotprocessor.service.reconcile;

import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.eyelevel.lotprocessor.repository.BatchJobRepository;
import com.eyelevel.lotprocessor.service.inference.InferenceRequestFactory;
import com.eyelevel.lotprocessor.service.inference.InferenceRequestLine;
import com.eyelevel.lotprocessor.service.inference.RemoteBatchSnapshot;
import com.eyelevel.lotprocessor.service.inference.RemoteBatchStatus;
import com.eyelevel.lotprocessor.service.inference.RemoteInferenceGateway;
import com.eyelevel.lotprocessor.service.job.JobLifecycleManager;
import com.eyelevel.lotprocessor.service.job.VisionOutcome;
import com.eyelevel.lotprocessor.service.result.CustomId;
import com.eyelevel.lotprocessor.service.result.InferencePhase;
import com.eyelevel.lotprocessor.service.result.InferenceResult;
import com.eyelevel.lotprocessor.service.result.InferenceResultParser;
import com.eyelevel.lotprocessor.service.result.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Brings local job state in line with the remote batches. Each pass polls every job with a batch in flight,
 * plus failed jobs that still hold a batch reference, since a local failure is never authoritative over
 * remote progress.
 *
 * <p>Network calls happen outside of transactions; state changes go through {@link JobLifecycleManager}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchReconciliationService {

    private static final Set<JobStatus> ACTIVE_STATUSES = Set.of(JobStatus.PROCESSING, JobStatus.TRANSLATING);

    private final BatchJobRepository batchJobRepository;
    private final JobLifecycleManager jobLifecycleManager;
    private final RemoteInferenceGateway inferenceGateway;
    private final InferenceResultParser resultParser;
    private final InferenceRequestFactory requestFactory;

    /**
     * Reconciles every candidate job. An error in one job is logged and leaves the others unaffected.
     *
     * @return The number of jobs reconciled without error.
     */
    public int reconcileActiveJobs() {
        List<UUID> jobIds = batchJobRepository.findIdsForReconciliation(ACTIVE_STATUSES, JobStatus.FAILED);
        if (jobIds.isEmpty()) {
            log.debug("No jobs to reconcile");
            return 0;
        }
        log.info("Reconciling {} job(s)", jobIds.size());
        int reconciled = 0;
        for (UUID jobId : jobIds) {
            try {
                reconcileJob(jobId);
                reconciled++;
            } catch (Exception e) {
                log.error("Error reconciling job {}. It will be checked again on the next run.", jobId, e);
            }
        }
        return reconciled;
    }

    public void reconcileJob(final UUID jobId) {
        BatchJob job = batchJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Job {} disappeared before reconciliation", jobId);
            return;
        }
        JobStatus status = job.getStatus();
        if (status == JobStatus.TRANSLATING || (status == JobStatus.FAILED && job.getTranslationBatchRef() != null)) {
            reconcileTranslation(job);
        } else if (status == JobStatus.PROCESSING
                   || (status == JobStatus.FAILED && job.getVisionBatchRef() != null)) {
            reconcileVision(job);
        } else {
            log.debug("Job {} is {}; nothing to reconcile", jobId, status);
        }
    }

    private void reconcileVision(final BatchJob job) {
        UUID jobId = job.getId();
        if (job.getVisionBatchRef() == null) {
            log.warn("Job {} is PROCESSING without a vision batch reference", jobId);
            return;
        }
        RemoteBatchSnapshot snapshot = inferenceGateway.poll(job.getVisionBatchRef());
        if (snapshot.status() == RemoteBatchStatus.FAILED) {
            jobLifecycleManager.failJob(jobId, "vision batch failed (provider status: " + snapshot.providerStatus() + ")");
            return;
        }
        if (snapshot.status() != RemoteBatchStatus.COMPLETED) {
            log.debug("Vision batch {} of job {} is {}", snapshot.batchRef(), jobId, snapshot.status());
            return;
        }

        InferenceResultParser.ParsedResults parsed = download(snapshot);
        if (job.getStatus() == JobStatus.FAILED && !jobLifecycleManager.recoverJob(jobId, JobStatus.PROCESSING)) {
            return;
        }

        Map<String, ResponseEnvelope> envelopes = new HashMap<>();
        for (InferenceResult result : parsed.results()) {
            if (result.customId().phase() == InferencePhase.VISION) {
                envelopes.merge(result.customId().lotId(), result.envelope(), BatchReconciliationService::preferText);
            }
        }
        VisionOutcome outcome = jobLifecycleManager.applyVisionResults(jobId, envelopes, !parsed.isEmpty());
        if (outcome.applied() && !outcome.completed()) {
            submitTranslation(jobId, outcome);
        }
    }

    private void submitTranslation(final UUID jobId, final VisionOutcome outcome) {
        List<InferenceRequestLine> requests = new ArrayList<>();
        for (VisionOutcome.TranslationWork work : outcome.translationWork()) {
            for (String language : outcome.targetLanguages()) {
                requests.add(requestFactory.translationRequest(work.lotId(), work.englishText(), language));
            }
        }
        try {
            String batchRef = inferenceGateway.submit(requests, "translation for job " + jobId);
            jobLifecycleManager.markTranslationSubmitted(jobId, batchRef);
        } catch (Exception e) {
            log.error("Translation batch submission failed for job {}", jobId, e);
            jobLifecycleManager.failJob(jobId, "Translation batch submission failed: " + e.getMessage());
        }
    }

    private void reconcileTranslation(final BatchJob job) {
        UUID jobId = job.getId();
        RemoteBatchSnapshot snapshot = inferenceGateway.poll(job.getTranslationBatchRef());
        if (snapshot.status() == RemoteBatchStatus.FAILED) {
            jobLifecycleManager.failJob(jobId,
                                        "translation batch failed (provider status: " + snapshot.providerStatus() + ")");
            return;
        }
        if (snapshot.status() != RemoteBatchStatus.COMPLETED) {
            log.debug("Translation batch {} of job {} is {}", snapshot.batchRef(), jobId, snapshot.status());
            return;
        }

        InferenceResultParser.ParsedResults parsed = download(snapshot);
        if (job.getStatus() == JobStatus.FAILED && !jobLifecycleManager.recoverJob(jobId, JobStatus.TRANSLATING)) {
            return;
        }

        Map<CustomId, ResponseEnvelope> envelopes = new HashMap<>();
        for (InferenceResult result : parsed.results()) {
            if (result.customId().phase() == InferencePhase.TRANSLATION) {
                envelopes.merge(result.customId(), result.envelope(), BatchReconciliationService::preferText);
            }
        }
        jobLifecycleManager.applyTranslationResults(jobId, envelopes);
    }

    /**
     * Parses the output file and, when present, the error file, which holds the lines of failed requests.
     */
    private InferenceResultParser.ParsedResults download(final RemoteBatchSnapshot snapshot) {
        List<InferenceResult> results = new ArrayList<>();
        int skipped = 0;
        for (String fileRef : new String[]{snapshot.outputRef(), snapshot.errorRef()}) {
            if (fileRef == null) {
                continue;
            }
            InferenceResultParser.ParsedResults parsed = resultParser.parse(inferenceGateway.download(fileRef));
            log.info("Batch {}: {} result line(s) from file {} ({} skipped)", snapshot.batchRef(),
                     parsed.results().size(), fileRef, parsed.skippedLines());
            results.addAll(parsed.results());
            skipped += parsed.skippedLines();
        }
        if (snapshot.resultRef() == null) {
            log.warn("Batch {} completed without output or error file", snapshot.batchRef());
        }
        return new InferenceResultParser.ParsedResults(results, skipped);
    }

    private static ResponseEnvelope preferText(final ResponseEnvelope first, final ResponseEnvelope second) {
        return first.extractText().isPresent() || second.extractText().isEmpty() ? first : second;
    }
}
