package com.eyelevel.lotprocessor.model;

import java.util.Set;

/**
 * Defines the lifecycle states of a {@link BatchJob}.
 */
public enum JobStatus {
    /**
     * The job and its lots are stored but the vision batch has not been submitted yet.
     */
    PENDING,
    /**
     * The vision batch is running remotely, or its results are being ingested.
     */
    PROCESSING,
    /**
     * Vision results are ingested and the translation batch is running remotely.
     */
    TRANSLATING,
    /**
     * Every lot reached a terminal state and webhook deliveries were created.
     */
    COMPLETED,
    /**
     * Submission or a remote batch failed. Not final: the job is still polled while it holds a batch
     * reference and recovers if the remote batch turns out to have completed.
     */
    FAILED,
    /**
     * Cancelled by a client. Local processing stops; the remote batch is not cancelled.
     */
    CANCELLED;

    public static final Set<JobStatus> CANCELLABLE = Set.of(PENDING, PROCESSING, TRANSLATING);

    public static final Set<JobStatus> RETAINABLE_TERMINAL = Set.of(COMPLETED, FAILED, CANCELLED);
}
