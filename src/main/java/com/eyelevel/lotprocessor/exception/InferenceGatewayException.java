package com.eyelevel.lotprocessor.exception;

import java.io.Serial;

/**
 * Wraps unexpected failures inside the inference provider client that are not already described by
 * an {@link com.eyelevel.lotprocessor.exception.apiclient.ApiException}.
 */
public class InferenceGatewayException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6021189342873304511L;

    public InferenceGatewayException(String message) {
        super(message);
    }

    public InferenceGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
