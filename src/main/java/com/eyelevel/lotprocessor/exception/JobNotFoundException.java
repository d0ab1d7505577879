package com.eyelevel.lotprocessor.exception;

import java.io.Serial;
import java.util.UUID;

/**
 * Thrown when a batch job id does not resolve to a stored job.
 */
public class JobNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -7719620145802218953L;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }

    public JobNotFoundException(String message) {
        super(message);
    }
}
