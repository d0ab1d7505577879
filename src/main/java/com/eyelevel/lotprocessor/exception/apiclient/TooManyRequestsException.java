package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is rate limiting this client (HTTP 429). Safe to retry later.
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7301889126650319944L;

    public TooManyRequestsException(String body) {
        super(body, 429, body);
    }
}
