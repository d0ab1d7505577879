package com.eyelevel.lotprocessor.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Represents a successful (2xx) response from an external API call.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The raw response body; empty for responses without content.
     */
    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;

    /**
     * @return The body decoded as UTF-8, or an empty string when there is no body.
     */
    public String getBodyAsString() {
        return data == null ? "" : new String(data, StandardCharsets.UTF_8);
    }
}
