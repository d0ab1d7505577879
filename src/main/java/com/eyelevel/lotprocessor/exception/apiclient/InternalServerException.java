package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service failed while handling the request (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6624709281143155802L;

    public InternalServerException(String body) {
        super(body, 500, body);
    }
}
