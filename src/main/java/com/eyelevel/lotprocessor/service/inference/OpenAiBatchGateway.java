package com.eyelevel.lotprocessor.service.inference;

import com.eyelevel.lotprocessor.common.apiclient.inference.InferenceApiClient;
import com.eyelevel.lotprocessor.common.json.JsonSerializer;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.dto.inference.CreateBatchRequest;
import com.eyelevel.lotprocessor.dto.inference.ProviderBatch;
import com.eyelevel.lotprocessor.dto.inference.ProviderFile;
import com.eyelevel.lotprocessor.exception.InferenceGatewayException;
import com.eyelevel.lotprocessor.exception.apiclient.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link RemoteInferenceGateway} backed by the OpenAI Batch API. A submission uploads the requests as a
 * JSONL file and then creates a batch over it.
 */
@Slf4j
@Service
public class OpenAiBatchGateway implements RemoteInferenceGateway {

    private final InferenceApiClient inferenceApiClient;
    private final JsonSerializer jsonSerializer;
    private final LotProcessingConfig config;

    public OpenAiBatchGateway(final InferenceApiClient inferenceApiClient,
                              @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
                              final LotProcessingConfig config) {
        this.inferenceApiClient = inferenceApiClient;
        this.jsonSerializer = jsonSerializer;
        this.config = config;
    }

    /**
     * Transient provider failures (rate limiting, 5xx, connection problems, timeouts) are retried with
     * exponential backoff; client errors fail immediately.
     */
    @Override
    @Retryable(retryFor = {TooManyRequestsException.class, InternalServerException.class, BadGatewayException.class,
                           ServiceUnavailableException.class, GatewayTimeoutException.class},
               maxAttemptsExpression = "#{${app.processing.inference.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.processing.inference.retry.delay-ms}}", multiplier = 2),
               listeners = {"inferenceRetryListener"})
    public String submit(final List<InferenceRequestLine> requests, final String description) {
        if (requests == null || requests.isEmpty()) {
            throw new InferenceGatewayException("Cannot submit an empty batch");
        }
        final String jsonl = requests.stream().map(jsonSerializer::serialize).collect(Collectors.joining("\n"));
        final String fileName = "batch_" + System.currentTimeMillis() + ".jsonl";
        log.info("Submitting batch of {} requests ({})", requests.size(), description);

        final ProviderFile file = inferenceApiClient.uploadBatchFile(fileName, jsonl);
        final LotProcessingConfig.Inference inference = config.getInference();
        final ProviderBatch batch = inferenceApiClient.createBatch(new CreateBatchRequest(
                file.id(), inference.getEndpoint(), inference.getCompletionWindow(),
                Map.of("description", description)));

        if (batch == null || batch.id() == null) {
            throw new InferenceGatewayException("Provider returned a batch without id for file " + file.id());
        }
        return batch.id();
    }

    @Override
    public RemoteBatchSnapshot poll(final String batchRef) {
        final ProviderBatch batch = inferenceApiClient.retrieveBatch(batchRef);
        final RemoteBatchStatus status = RemoteBatchStatus.fromProvider(batch.status());
        if (status == RemoteBatchStatus.UNKNOWN) {
            log.warn("Batch {} reported unrecognized status '{}'; treating it as in progress.", batchRef,
                     batch.status());
        }
        log.debug("Batch {} is {} (provider status: {})", batchRef, status, batch.status());
        return new RemoteBatchSnapshot(batchRef, status, batch.status(), batch.outputFileId(), batch.errorFileId());
    }

    @Override
    public String download(final String fileRef) {
        return inferenceApiClient.downloadFileContent(fileRef);
    }
}
