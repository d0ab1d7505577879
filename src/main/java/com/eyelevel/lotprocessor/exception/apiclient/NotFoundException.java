package com.eyelevel.lotprocessor.exception.apiclient;

import java.io.Serial;

/**
 * The remote resource does not exist (HTTP 404), e.g. an unknown batch or file id.
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public NotFoundException(String body) {
        super(body, 404, body);
    }
}
