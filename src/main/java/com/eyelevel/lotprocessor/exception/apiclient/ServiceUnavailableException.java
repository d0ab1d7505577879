package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is unavailable. Raised both for an HTTP 503 answer and for connection-level
 * failures where no answer was received at all.
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1873904529714006617L;

    public ServiceUnavailableException(String body) {
        super(body, 503, body);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, 503, null, cause);
    }
}
