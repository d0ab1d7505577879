package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service did not accept the supplied credentials (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2281736114572390014L;

    public UnauthorizedException(String body) {
        super(body, 401, body);
    }
}
