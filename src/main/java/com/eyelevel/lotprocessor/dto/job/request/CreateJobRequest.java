package com.eyelevel.lotprocessor.dto.job.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Schema(description = "A signed request to generate damage descriptions for a set of vehicle lots.")
public class CreateJobRequest {

    @Schema(description = "Hex HMAC-SHA256 of the canonical JSON of 'lots', keyed by the shared key.",
            example = "3f1c9a0e5b...")
    private String signature;

    @NotBlank(message = "version is required")
    @Schema(description = "Request format version.", example = "1.0.0")
    private String version;

    @NotEmpty(message = "languages must not be empty")
    @Schema(description = "Language codes to describe the lots in. English is always produced.", example = "[\"en\", \"fr\"]")
    private List<String> languages = new ArrayList<>();

    @Valid
    @NotEmpty(message = "lots must not be empty")
    private List<LotRequest> lots = new ArrayList<>();

    @JsonProperty("webhook_url")
    @Schema(description = "URL that receives the results once the job completes.", nullable = true)
    private String webhookUrl;

    @Getter
    @Setter
    @Schema(description = "One vehicle lot.")
    public static class LotRequest {

        @NotBlank(message = "lot_id is required")
        @JsonProperty("lot_id")
        @Schema(example = "LOT-1042")
        private String lotId;

        @JsonProperty("additional_info")
        @Schema(description = "Free text passed to the model with the images.", nullable = true)
        private String additionalInfo;

        @Schema(description = "Image URLs. A lot without images fails with 'no_images'.")
        private List<ImageRequest> images = new ArrayList<>();

        @JsonProperty("webhook_url")
        @Schema(description = "Overrides the job's webhook URL for this lot.", nullable = true)
        private String webhookUrl;
    }

    @Getter
    @Setter
    public static class ImageRequest {

        @Schema(example = "https://cdn.example.com/lots/1042/front.jpg")
        private String url;
    }
}
