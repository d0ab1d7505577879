package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The credentials were accepted but lack permission for the operation (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5534421890034176262L;

    public ForbiddenException(String body) {
        super(body, 403, body);
    }
}
