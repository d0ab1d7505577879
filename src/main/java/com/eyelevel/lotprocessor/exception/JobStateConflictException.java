package com.eyelevel.lotprocessor.exception;

import java.io.Serial;

/**
 * Thrown when an operation is requested for a job or delivery whose current status does not allow it,
 * e.g. cancelling a completed job.
 */
public class JobStateConflictException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3102257809946635174L;

    public JobStateConflictException(String message) {
        super(message);
    }
}
