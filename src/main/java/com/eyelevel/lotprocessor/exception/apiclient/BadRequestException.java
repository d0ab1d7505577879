package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8812003719465291201L;

    public BadRequestException(String body) {
        super(body, 400, body);
    }
}
