package com.eyelevel.lotprocessor.service.job;

import java.util.List;

/**
 * One lot as submitted by a client.
 *
 * @param imageUrls  Image URLs; blank entries are ignored.
 * @param webhookUrl Overrides the job's webhook URL for this lot, may be {@code null}.
 */
public record LotSubmission(String lotId, String additionalInfo, List<String> imageUrls, String webhookUrl) {
}
