package com.eyelevel.lotprocessor.exception;

import java.io.Serial;

/**
 * A base exception for invalid input or invalid state while creating or handling a batch job.
 */
public class LotProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public LotProcessingException(String message) {
        super(message);
    }

    public LotProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
