package com.eyelevel.lotprocessor.exception.apiclient;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.io.Serial;

/**
 * Base class for errors raised while calling a remote HTTP service.
 *
 * <p>Carries the HTTP status code and, when the remote side actually answered, the raw response body.
 * A {@code null} response body means the request never produced a response (connection refused,
 * DNS failure, timeout), in which case {@link #getStatusCode()} is a synthetic gateway code.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;
    @Nullable
    private final String responseBody;

    /**
     * Constructs an exception that is not backed by a remote response.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        this(message, statusCode, null, null);
    }

    /**
     * Constructs an exception for a response the remote service returned.
     *
     * @param message      A descriptive message about the exception.
     * @param statusCode   The HTTP status code returned by the remote service.
     * @param responseBody The body returned by the remote service.
     */
    public ApiException(String message, int statusCode, @Nullable String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    protected ApiException(String message, int statusCode, @Nullable String responseBody, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * @return {@code true} when the remote service answered with an HTTP status, {@code false} for
     * transport-level failures.
     */
    public boolean hasResponse() {
        return responseBody != null;
    }
}
