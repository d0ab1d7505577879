package com.eyelevel.lotprocessor.dto.job.response;

import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A read-only view of a job's progress.
 *
 * @param progressPercentage Share of lots that reached a result or failed, 0 to 100.
 */
public record JobStatusSnapshot(
        UUID jobId,
        JobStatus status,
        List<String> languages,
        int totalLots,
        int processedLots,
        int failedLots,
        double progressPercentage,
        String visionBatchRef,
        String translationBatchRef,
        String errorMessage,
        int retryCount,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {

    public static JobStatusSnapshot from(BatchJob job) {
        return new JobStatusSnapshot(job.getId(), job.getStatus(), List.copyOf(job.getLanguages()),
                                     job.getTotalLots(), job.getProcessedLots(), job.getFailedLots(),
                                     progress(job), job.getVisionBatchRef(), job.getTranslationBatchRef(),
                                     job.getErrorMessage(), job.getRetryCount(), job.getCreatedAt(),
                                     job.getUpdatedAt(), job.getCompletedAt());
    }

    private static double progress(BatchJob job) {
        if (job.getStatus() == JobStatus.COMPLETED) {
            return 100.0;
        }
        if (job.getTotalLots() == 0) {
            return 0.0;
        }
        int settled = Math.min(job.getTotalLots(), job.getProcessedLots() + job.getFailedLots());
        return Math.round(settled * 1000.0 / job.getTotalLots()) / 10.0;
    }
}
