package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The call did not complete in time. Raised both for an HTTP 504 answer and for a client-side timeout.
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2290516077328441904L;

    public GatewayTimeoutException(String body) {
        super(body, 504, body);
    }

    public GatewayTimeoutException(String message, Throwable cause) {
        super(message, 504, null, cause);
    }
}
