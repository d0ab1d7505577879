package com.eyelevel.lotprocessor.service.inference;

import java.util.List;

/**
 * Submission, polling and result download against the asynchronous batch inference provider.
 * Implementations hold no local state.
 */
public interface RemoteInferenceGateway {

    /**
     * Submits all requests as a single remote batch.
     *
     * @param requests    The requests, at least one.
     * @param description Free-text description attached to the batch.
     * @return The remote batch reference.
     */
    String submit(List<InferenceRequestLine> requests, String description);

    /**
     * Reads the current remote state of a batch.
     */
    RemoteBatchSnapshot poll(String batchRef);

    /**
     * Downloads a result file as newline-delimited JSON text.
     */
    String download(String fileRef);
}
