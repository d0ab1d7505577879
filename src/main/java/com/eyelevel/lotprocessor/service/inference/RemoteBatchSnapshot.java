package com.eyelevel.lotprocessor.service.inference;

/**
 * The state of a remote batch as observed by one poll.
 *
 * @param batchRef       The batch reference that was polled.
 * @param status         The mapped status.
 * @param providerStatus The raw provider status, for logging.
 * @param outputRef      Reference to the result file, once available.
 * @param errorRef       Reference to the per-request error file, if any request failed.
 */
public record RemoteBatchSnapshot(String batchRef, RemoteBatchStatus status, String providerStatus,
                                  String outputRef, String errorRef) {

    /**
     * @return The file holding the result lines: the output file, or the error file when every request failed.
     */
    public String resultRef() {
        return outputRef != null ? outputRef : errorRef;
    }
}
