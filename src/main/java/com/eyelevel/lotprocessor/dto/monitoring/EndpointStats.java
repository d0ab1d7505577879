package com.eyelevel.lotprocessor.dto.monitoring;

/**
 * Raw per-URL delivery counts as aggregated by the store.
 */
public record EndpointStats(String webhookUrl, Long total, Long delivered, Long failed) {
}
