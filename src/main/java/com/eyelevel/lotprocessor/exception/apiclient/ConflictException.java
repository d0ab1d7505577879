package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service reported a state conflict (HTTP 409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 1994476303391182537L;

    public ConflictException(String body) {
        super(body, 409, body);
    }
}
