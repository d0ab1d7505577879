package com.eyelevel.lotprocessor.common.apiclient;

import com.eyelevel.lotprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.lotprocessor.common.apiclient.model.ApiRequest;
import com.eyelevel.lotprocessor.common.apiclient.model.ApiResponse;
import com.eyelevel.lotprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.lotprocessor.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for API clients, providing common functionality for making blocking calls
 * over a {@link WebClient}, handling responses, and mapping failures onto the
 * {@link ApiException} hierarchy.
 *
 * <p>Every call is bounded by a timeout: the per-request {@link ApiRequest#getTimeout()} when set,
 * otherwise the client default.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    @Nullable
    protected final Authentication authentication;
    @Nullable
    protected final HeaderConfig headerConfig;
    private final Duration defaultTimeout;

    protected ApiClient(WebClient webClient, @Nullable Authentication authentication,
                        @Nullable HeaderConfig headerConfig, Duration defaultTimeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.headerConfig = headerConfig;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Executes an API call based on the provided {@link ApiRequest}.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The response of a 2xx answer.
     *
     * @throws ApiException for non-2xx answers and for transport failures.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        Duration timeout = Optional.ofNullable(apiRequest.getTimeout()).orElse(defaultTimeout);
        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(timeout)
                                                     .onErrorMap(this::mapException)
                                                     .block();
            if (apiResponse == null) {
                throw new ApiException("Empty response from " + apiRequest.getPath(),
                                       HttpStatus.BAD_GATEWAY.value());
            }
            log.debug("Received status {} from {}", apiResponse.getStatusCode(), apiRequest.getPath());
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call {} {} failed with status {}: {}", apiRequest.getMethod(), apiRequest.getPath(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected exception during API call to {}", apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    /**
     * Maps exceptions to the {@link ApiException} hierarchy. Transport failures produce exceptions without
     * a response body so callers can tell them apart from answers the remote side gave.
     */
    private ApiException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        Throwable root = rootCause(error);
        if (error instanceof TimeoutException || root instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage(), error);
        }
        if (error instanceof WebClientRequestException || root instanceof ConnectException ||
            root instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + root.getMessage(),
                                                   error);
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        if (apiRequest.isAbsolute()) {
            return webClient.method(apiRequest.getMethod()).uri(URI.create(apiRequest.getPath()));
        }
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Applies client-wide headers first, then authentication and per-request headers, which win on conflict.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (headerConfig != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.name(), header.value()));
        }
        if (authentication != null) {
            authentication.applyAuthentication(apiRequest.getHeaders());
        }
        apiRequest.getHeaders().forEach((name, value) -> requestBodySpec.headers(h -> h.set(name, value)));
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new ApiException("Invalid request body: " + e.getMessage(), HttpStatus.BAD_REQUEST.value());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            HttpHeaders headers = response.headers().asHttpHeaders();
            Instant timestamp = Instant.now();
            return response.bodyToMono(byte[].class)
                           .defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder()
                                                   .data(data)
                                                   .contentType(headers.getContentType())
                                                   .headers(headers)
                                                   .statusCode(statusCode)
                                                   .timestamp(timestamp)
                                                   .build());
        }
        log.debug("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class)
                       .defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    /**
     * Creates the {@link ApiException} subtype matching an HTTP status code.
     */
    private ApiException createException(String body, int statusCode) {
        return switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode, body);
        };
    }
}
