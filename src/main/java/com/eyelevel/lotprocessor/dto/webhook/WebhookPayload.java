package com.eyelevel.lotprocessor.dto.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The body POSTed to a webhook URL when a job completes. Receivers verify the {@code X-Signature}
 * header against the canonical JSON of this payload without its {@code signature} field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookPayload(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("completed_at") String completedAt,
        @JsonProperty("lots") List<LotResult> lots,
        @JsonProperty("signature") String signature
) {

    public WebhookPayload withSignature(String signature) {
        return new WebhookPayload(jobId, status, completedAt, lots, signature);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LotResult(
            @JsonProperty("lot_id") String lotId,
            @JsonProperty("status") String status,
            @JsonProperty("descriptions") List<Description> descriptions,
            @JsonProperty("missing_images") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> missingImages,
            @JsonProperty("error") String error
    ) {
    }

    /**
     * @param damages The description as an HTML paragraph.
     */
    public record Description(
            @JsonProperty("language") String language,
            @JsonProperty("damages") String damages
    ) {
    }
}
