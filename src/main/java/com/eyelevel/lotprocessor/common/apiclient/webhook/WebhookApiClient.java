package com.eyelevel.lotprocessor.common.apiclient.webhook;

import com.eyelevel.lotprocessor.common.apiclient.ApiClient;
import com.eyelevel.lotprocessor.common.apiclient.model.ApiRequest;
import com.eyelevel.lotprocessor.common.apiclient.model.ApiResponse;
import com.eyelevel.lotprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts signed payloads to client webhook URLs. Redirects are not followed, so a 3xx answer is a failed
 * delivery like any other non-2xx status.
 */
@Slf4j
@Service("webhookApiClient")
public class WebhookApiClient extends ApiClient {

    public static final String SIGNATURE_HEADER = "X-Signature";

    public WebhookApiClient(@Qualifier("webhookWebClient") final WebClient webClient,
                            @Qualifier("webhookHeaderConfig") final HeaderConfig headerConfig,
                            final LotProcessingConfig config) {
        super(webClient, null, headerConfig, config.getWebhook().getTimeout());
    }

    /**
     * @param url       Absolute target URL.
     * @param payload   The JSON payload, sent verbatim.
     * @param signature Hex HMAC of the payload, sent as {@value #SIGNATURE_HEADER}.
     * @return The 2xx response.
     * @throws ApiException for non-2xx answers, timeouts and connection failures.
     */
    public ApiResponse post(final String url, final String payload, final String signature) {
        ApiRequest apiRequest = ApiRequest.builder()
                                          .method(HttpMethod.POST)
                                          .path(url)
                                          .contentType(MediaType.APPLICATION_JSON)
                                          .body(payload)
                                          .build();
        apiRequest.getHeaders().put(SIGNATURE_HEADER, signature);
        return call(apiRequest);
    }
}
