package com.eyelevel.lotprocessor.common.apiclient.authentication.impl;

import com.eyelevel.lotprocessor.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * An implementation of {@link Authentication} that sends a static API key as an
 * {@code Authorization: Bearer} header, the scheme used by the inference provider.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (headers == null) {
            log.error("Header map cannot be null when applying bearer token authentication.");
            return;
        }
        if (token == null || token.isBlank()) {
            log.warn("No bearer token configured; sending request without Authorization header.");
            return;
        }
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[token=****]";
    }
}
