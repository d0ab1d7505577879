package com.eyelevel.lotprocessor.exception;

import java.io.Serial;

/**
 * Thrown when an inbound request carries an HMAC signature that does not match its content.
 */
public class InvalidSignatureException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2560093741250176398L;

    public InvalidSignatureException(String message) {
        super(message);
    }
}
