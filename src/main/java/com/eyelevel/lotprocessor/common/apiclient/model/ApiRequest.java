package com.eyelevel.lotprocessor.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to an external API.
 *
 * <p>The {@code path} is resolved against the client's base URL unless it is an absolute
 * {@code http(s)} URL, which is used as-is. Webhook targets rely on the absolute form.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Request headers. Mutable so authentication and per-call headers can be added after building.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The request body: a POJO or map written as JSON, a raw string, or a multipart map.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    /**
     * The content type of the request body. Defaults to JSON when a body is present.
     */
    @Nullable
    private final MediaType contentType;

    /**
     * Per-call timeout overriding the client default.
     */
    @Nullable
    private final Duration timeout;

    public boolean isAbsolute() {
        return path != null && (path.startsWith("http://") || path.startsWith("https://"));
    }
}
