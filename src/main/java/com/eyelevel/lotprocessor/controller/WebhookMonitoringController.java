package com.eyelevel.lotprocessor.controller;

import com.eyelevel.lotprocessor.dto.common.ApiResponse;
import com.eyelevel.lotprocessor.dto.monitoring.DeliveryMetrics;
import com.eyelevel.lotprocessor.dto.monitoring.EndpointHealth;
import com.eyelevel.lotprocessor.dto.monitoring.FailedDelivery;
import com.eyelevel.lotprocessor.dto.monitoring.WebhookAlert;
import com.eyelevel.lotprocessor.dto.monitoring.WebhookSummaryReport;
import com.eyelevel.lotprocessor.service.monitoring.WebhookMonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class WebhookMonitoringController implements WebhookMonitoringApi {

    private final WebhookMonitoringService monitoringService;

    @Override
    @GetMapping("/webhook-metrics")
    public ResponseEntity<ApiResponse<DeliveryMetrics>> getMetrics(
            @RequestParam(value = "hours", defaultValue = "24") final int hours) {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getDeliveryMetrics(hours),
                                                     "Webhook metrics retrieved successfully.", HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/webhook-health")
    public ResponseEntity<ApiResponse<WebhookSummaryReport>> getHealth() {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getSummaryReport(),
                                                     "Webhook health report generated successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/webhook-failures")
    public ResponseEntity<ApiResponse<List<FailedDelivery>>> getFailures(
            @RequestParam(value = "limit", defaultValue = "10") final int limit) {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getFailedDeliveries(limit),
                                                     "Failed webhook deliveries retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/webhook-endpoints")
    public ResponseEntity<ApiResponse<List<EndpointHealth>>> getEndpoints() {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getEndpointHealth(),
                                                     "Webhook endpoint health retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/webhook-alerts")
    public ResponseEntity<ApiResponse<List<WebhookAlert>>> getAlerts() {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.checkAlerts(),
                                                     "Webhook alerts retrieved successfully.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/webhook-deliveries/{deliveryId}/retry")
    public ResponseEntity<ApiResponse<Object>> retryDelivery(@PathVariable("deliveryId") final Long deliveryId) {
        log.info("Manual retry requested for webhook delivery {}", deliveryId);
        monitoringService.retryDelivery(deliveryId);
        return ResponseEntity.ok(ApiResponse.success(null, "Webhook delivery re-queued.", HttpStatus.OK.value()));
    }
}
