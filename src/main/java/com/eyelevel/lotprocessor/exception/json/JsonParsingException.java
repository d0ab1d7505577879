package com.eyelevel.lotprocessor.exception.json;

import java.io.Serial;

/**
 * Thrown when JSON cannot be read or written: inference result lines, stored lot columns,
 * webhook payloads.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message) {
        super(message);
    }

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
