package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * An upstream proxy of the remote service failed (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3379105240087165525L;

    public BadGatewayException(String body) {
        super(body, 502, body);
    }
}
