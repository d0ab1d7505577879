package com.eyelevel.lotprocessor.controller;

import com.eyelevel.lotprocessor.dto.common.ApiResponse;
import com.eyelevel.lotprocessor.dto.monitoring.DeliveryMetrics;
import com.eyelevel.lotprocessor.dto.monitoring.EndpointHealth;
import com.eyelevel.lotprocessor.dto.monitoring.FailedDelivery;
import com.eyelevel.lotprocessor.dto.monitoring.WebhookAlert;
import com.eyelevel.lotprocessor.dto.monitoring.WebhookSummaryReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Webhook Monitoring", description = "Health, metrics and manual recovery of webhook deliveries.")
public interface WebhookMonitoringApi {

    @Operation(summary = "Delivery Metrics", description = "Counts, success rate, average retries and delivery time over the last N hours.")
    ResponseEntity<ApiResponse<DeliveryMetrics>> getMetrics(
            @Parameter(description = "Window size in hours.", example = "24") @RequestParam(value = "hours", defaultValue = "24")
            @Min(value = 1, message = "hours must be at least 1")
            @Max(value = 720, message = "hours must be at most 720") int hours);

    @Operation(summary = "Health Report", description = "Summary report with a 0-100 health score and the active alerts.")
    ResponseEntity<ApiResponse<WebhookSummaryReport>> getHealth();

    @Operation(summary = "Failed Deliveries", description = "Deliveries that exhausted their attempts, most recent first.")
    ResponseEntity<ApiResponse<List<FailedDelivery>>> getFailures(
            @Parameter(description = "Maximum number of entries.", example = "10") @RequestParam(value = "limit", defaultValue = "10")
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = 100, message = "limit must be at most 100") int limit);

    @Operation(summary = "Endpoint Health", description = "Per-URL delivery statistics, worst success rate first.")
    ResponseEntity<ApiResponse<List<EndpointHealth>>> getEndpoints();

    @Operation(summary = "Active Alerts")
    ResponseEntity<ApiResponse<List<WebhookAlert>>> getAlerts();

    @Operation(summary = "Retry Delivery", description = "Re-queues a permanently failed delivery with a fresh set of attempts.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Delivery re-queued."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown delivery.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Delivery is not in a failed state.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Object>> retryDelivery(
            @Parameter(description = "The delivery id.", required = true) @PathVariable("deliveryId") Long deliveryId);
}
