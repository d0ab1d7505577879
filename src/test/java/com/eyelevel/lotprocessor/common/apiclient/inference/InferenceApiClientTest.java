package com.eyelevel.lotprocessor.common.apiclient.inference;

import com.eyelevel.lotprocessor.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.lotprocessor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.lotprocessor.dto.inference.CreateBatchRequest;
import com.eyelevel.lotprocessor.dto.inference.ProviderBatch;
import com.eyelevel.lotprocessor.dto.inference.ProviderFile;
import com.eyelevel.lotprocessor.exception.apiclient.BadRequestException;
import com.eyelevel.lotprocessor.exception.apiclient.TooManyRequestsException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InferenceApiClientTest {

    private MockWebServer server;
    private InferenceApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        WebClient webClient = WebClient.builder().baseUrl(server.url("/v1").toString()).build();
        client = new InferenceApiClient(webClient, new BearerTokenAuthentication("sk-test"),
                                        new JacksonJsonParser(new ObjectMapper()), Duration.ofSeconds(2));
        ReflectionTestUtils.setField(client, "filesEndpoint", "/files");
        ReflectionTestUtils.setField(client, "fileContentEndpoint", "/files/{fileId}/content");
        ReflectionTestUtils.setField(client, "batchesEndpoint", "/batches");
        ReflectionTestUtils.setField(client, "batchEndpoint", "/batches/{batchId}");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void uploadsJsonlAsMultipartWithBearerToken() throws InterruptedException {
        server.enqueue(json("{\"id\":\"file-1\",\"filename\":\"batch.jsonl\",\"purpose\":\"batch\",\"bytes\":12}"));

        ProviderFile file = client.uploadBatchFile("batch.jsonl", "{\"a\":1}\n{\"b\":2}");

        assertThat(file.id()).isEqualTo("file-1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/files");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("Content-Type")).startsWith("multipart/form-data");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("name=\"purpose\"").contains("batch")
                        .contains("filename=\"batch.jsonl\"").contains("{\"a\":1}\n{\"b\":2}");
    }

    @Test
    void createsAndRetrievesBatches() throws InterruptedException {
        server.enqueue(json("{\"id\":\"batch_1\",\"status\":\"validating\",\"input_file_id\":\"file-1\"}"));
        server.enqueue(json("{\"id\":\"batch_1\",\"status\":\"completed\",\"output_file_id\":\"file-out\"," +
                            "\"error_file_id\":\"file-err\",\"request_counts\":{\"total\":2,\"completed\":1,\"failed\":1}," +
                            "\"unexpected\":true}"));

        ProviderBatch created = client.createBatch(new CreateBatchRequest("file-1", "/v1/responses", "24h",
                                                                          Map.of("description", "vision")));
        ProviderBatch polled = client.retrieveBatch("batch_1");

        assertThat(created.status()).isEqualTo("validating");
        assertThat(polled.outputFileId()).isEqualTo("file-out");
        assertThat(polled.errorFileId()).isEqualTo("file-err");
        assertThat(polled.requestCounts().failed()).isEqualTo(1);

        RecordedRequest create = server.takeRequest();
        assertThat(create.getPath()).isEqualTo("/v1/batches");
        assertThat(create.getBody().readUtf8()).contains("\"input_file_id\":\"file-1\"")
                                               .contains("\"completion_window\":\"24h\"");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/batches/batch_1");
    }

    @Test
    void downloadsFileContentAsText() {
        server.enqueue(new MockResponse().setBody("{\"custom_id\":\"vision:A\"}\n"));

        assertThat(client.downloadFileContent("file-out")).isEqualTo("{\"custom_id\":\"vision:A\"}\n");
    }

    @Test
    void mapsErrorStatusesToTypedExceptions() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"slow down\"}"));
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad file\"}"));

        assertThatThrownBy(() -> client.retrieveBatch("batch_1")).isInstanceOf(TooManyRequestsException.class);
        assertThatThrownBy(() -> client.createBatch(new CreateBatchRequest("f", "/v1/responses", "24h", Map.of())))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("bad file");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
