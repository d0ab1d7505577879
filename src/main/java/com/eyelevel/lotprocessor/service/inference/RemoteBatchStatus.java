package com.eyelevel.lotprocessor.service.inference;

import java.util.Locale;

/**
 * Provider batch states collapsed onto what the orchestrator acts on.
 */
public enum RemoteBatchStatus {
    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    UNKNOWN;

    /**
     * Maps a provider status string. Unknown values are kept as {@link #UNKNOWN} and treated as still running.
     */
    public static RemoteBatchStatus fromProvider(String providerStatus) {
        if (providerStatus == null) {
            return UNKNOWN;
        }
        return switch (providerStatus.toLowerCase(Locale.ROOT)) {
            case "validating" -> QUEUED;
            case "in_progress", "finalizing", "cancelling" -> IN_PROGRESS;
            case "completed" -> COMPLETED;
            case "failed", "expired", "cancelled" -> FAILED;
            default -> UNKNOWN;
        };
    }
}
