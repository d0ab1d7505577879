package com.eyelevel.lotprocessor.common.apiclient.inference;

import com.eyelevel.lotprocessor.common.apiclient.ApiClient;
import com.eyelevel.lotprocessor.common.apiclient.authentication.Authentication;
import com.eyelevel.lotprocessor.common.apiclient.model.ApiRequest;
import com.eyelevel.lotprocessor.common.apiclient.model.ApiResponse;
import com.eyelevel.lotprocessor.common.json.JsonParser;
import com.eyelevel.lotprocessor.dto.inference.CreateBatchRequest;
import com.eyelevel.lotprocessor.dto.inference.ProviderBatch;
import com.eyelevel.lotprocessor.dto.inference.ProviderFile;
import com.eyelevel.lotprocessor.exception.InferenceGatewayException;
import com.eyelevel.lotprocessor.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Client for the provider's batch API: file upload, batch creation, batch retrieval and file download.
 */
@Slf4j
@Service("inferenceApiClient")
public class InferenceApiClient extends ApiClient {

    private static final MediaType JSONL = MediaType.parseMediaType("application/jsonl");

    private final JsonParser jsonParser;

    @Value("${app.inference-client.endpoint.files:/files}")
    private String filesEndpoint;

    @Value("${app.inference-client.endpoint.file-content:/files/{fileId}/content}")
    private String fileContentEndpoint;

    @Value("${app.inference-client.endpoint.batches:/batches}")
    private String batchesEndpoint;

    @Value("${app.inference-client.endpoint.batch:/batches/{batchId}}")
    private String batchEndpoint;

    /**
     * Constructs a new InferenceApiClient.
     *
     * @param webClient      The WebClient bound to the provider's base URL.
     * @param authentication Bearer-token authentication for the provider.
     * @param jsonParser     The JSON parser for provider responses.
     * @param timeout        Upper bound for a single call, downloads included.
     */
    public InferenceApiClient(
            @Qualifier("inferenceWebClient") final WebClient webClient,
            @Qualifier("inferenceAuthentication") final Authentication authentication,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.inference-client.timeout:60s}") final Duration timeout
    ) {
        super(webClient, authentication, null, timeout);
        this.jsonParser = jsonParser;
    }

    /**
     * Uploads a JSONL request file with purpose {@code batch}.
     *
     * @param fileName Name reported to the provider.
     * @param jsonl    One request per line.
     * @return The stored file descriptor.
     * @throws ApiException              if the provider rejects the upload.
     * @throws InferenceGatewayException if an unexpected error occurs.
     */
    public ProviderFile uploadBatchFile(final String fileName, final String jsonl) {
        try {
            MultipartBodyBuilder multipart = new MultipartBodyBuilder();
            multipart.part("purpose", "batch");
            multipart.part("file", new ByteArrayResource(jsonl.getBytes(StandardCharsets.UTF_8)))
                     .filename(fileName)
                     .contentType(JSONL);

            ApiRequest apiRequest = ApiRequest.builder()
                                              .method(HttpMethod.POST)
                                              .path(filesEndpoint)
                                              .contentType(MediaType.MULTIPART_FORM_DATA)
                                              .body(multipart.build())
                                              .acceptMediaType(MediaType.APPLICATION_JSON)
                                              .build();
            ProviderFile file = jsonParser.parseObject(call(apiRequest).getData(), ProviderFile.class);
            log.info("Uploaded batch input file '{}' as {}", fileName, file.id());
            return file;
        } catch (final ApiException e) {
            log.warn("Provider rejected upload of batch input file '{}'.", fileName, e);
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred while uploading batch input file '{}'.", fileName, e);
            throw new InferenceGatewayException("Unexpected error during batch file upload", e);
        }
    }

    /**
     * Creates a batch over a previously uploaded input file.
     *
     * @throws ApiException              if the provider rejects the batch.
     * @throws InferenceGatewayException if an unexpected error occurs.
     */
    public ProviderBatch createBatch(final CreateBatchRequest request) {
        try {
            ApiRequest apiRequest = ApiRequest.builder()
                                              .method(HttpMethod.POST)
                                              .path(batchesEndpoint)
                                              .body(request)
                                              .acceptMediaType(MediaType.APPLICATION_JSON)
                                              .build();
            ProviderBatch batch = jsonParser.parseObject(call(apiRequest).getData(), ProviderBatch.class);
            log.info("Created batch {} for input file {} (status: {})", batch.id(), request.inputFileId(),
                     batch.status());
            return batch;
        } catch (final ApiException e) {
            log.warn("Provider rejected batch creation for input file {}.", request.inputFileId(), e);
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred while creating a batch for input file {}.",
                      request.inputFileId(), e);
            throw new InferenceGatewayException("Unexpected error during batch creation", e);
        }
    }

    /**
     * Retrieves the current state of a batch.
     */
    public ProviderBatch retrieveBatch(final String batchId) {
        try {
            ApiRequest apiRequest = ApiRequest.builder()
                                              .method(HttpMethod.GET)
                                              .path(batchEndpoint)
                                              .pathVariables(Map.of("batchId", batchId))
                                              .acceptMediaType(MediaType.APPLICATION_JSON)
                                              .build();
            return jsonParser.parseObject(call(apiRequest).getData(), ProviderBatch.class);
        } catch (final ApiException e) {
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred while retrieving batch {}.", batchId, e);
            throw new InferenceGatewayException("Unexpected error while retrieving batch " + batchId, e);
        }
    }

    /**
     * Downloads the content of a result or error file as UTF-8 text.
     */
    public String downloadFileContent(final String fileId) {
        try {
            ApiRequest apiRequest = ApiRequest.builder()
                                              .method(HttpMethod.GET)
                                              .path(fileContentEndpoint)
                                              .pathVariables(Map.of("fileId", fileId))
                                              .build();
            ApiResponse apiResponse = call(apiRequest);
            String content = apiResponse.getBodyAsString();
            log.info("Downloaded file {} ({} chars)", fileId, content.length());
            return content;
        } catch (final ApiException e) {
            throw e;
        } catch (final Exception e) {
            log.error("An unexpected error occurred while downloading file {}.", fileId, e);
            throw new InferenceGatewayException("Unexpected error while downloading file " + fileId, e);
        }
    }
}
