package com.eyelevel.lotprocessor.common.apiclient.webhook;

import com.eyelevel.lotprocessor.common.apiclient.model.HeaderConfig;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.service.webhook.DeliveryResult;
import com.eyelevel.lotprocessor.service.webhook.WebhookSender;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookApiClientTest {

    private MockWebServer server;
    private WebhookSender sender;
    private String url;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        url = server.url("/hooks/lots").toString();

        LotProcessingConfig config = new LotProcessingConfig();
        config.getWebhook().setTimeout(Duration.ofMillis(500));
        WebhookApiClient client = new WebhookApiClient(WebClient.builder().build(),
                                                       HeaderConfig.of(Map.of("User-Agent", "Lot-Processor-Webhook/1.0")),
                                                       config);
        sender = new WebhookSender(client);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsPayloadVerbatimWithSignatureHeader() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("received"));
        String payload = "{\"job_id\":\"1\",\"lots\":[],\"status\":\"completed\"}";

        DeliveryResult result = sender.send(url, payload, "deadbeef");

        assertThat(result.success()).isTrue();
        assertThat(result.responseStatus()).isEqualTo(200);
        assertThat(result.responseBody()).isEqualTo("received");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/lots");
        assertThat(request.getHeader("X-Signature")).isEqualTo("deadbeef");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getHeader("User-Agent")).isEqualTo("Lot-Processor-Webhook/1.0");
        assertThat(request.getBody().readUtf8()).isEqualTo(payload);
    }

    @Test
    void serverErrorIsRecordedWithStatusAndBody() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("down"));

        DeliveryResult result = sender.send(url, "{}", "sig");

        assertThat(result.success()).isFalse();
        assertThat(result.responseStatus()).isEqualTo(500);
        assertThat(result.responseBody()).isEqualTo("down");
        assertThat(result.errorMessage()).isEqualTo("HTTP 500");
    }

    @Test
    void redirectIsNotFollowedAndCountsAsFailure() {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/elsewhere"));

        DeliveryResult result = sender.send(url, "{}", "sig");

        assertThat(result.success()).isFalse();
        assertThat(result.responseStatus()).isEqualTo(302);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void timeoutHasNoResponseStatus() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        DeliveryResult result = sender.send(url, "{}", "sig");

        assertThat(result.success()).isFalse();
        assertThat(result.responseStatus()).isNull();
        assertThat(result.errorMessage()).contains("timed out");
    }
}
