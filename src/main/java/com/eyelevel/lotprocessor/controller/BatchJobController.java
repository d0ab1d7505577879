package com.eyelevel.lotprocessor.controller;

import com.eyelevel.lotprocessor.common.json.JsonParser;
import com.eyelevel.lotprocessor.config.LotProcessingConfig;
import com.eyelevel.lotprocessor.dto.common.ApiResponse;
import com.eyelevel.lotprocessor.dto.job.request.CreateJobRequest;
import com.eyelevel.lotprocessor.dto.job.response.CreateJobResponse;
import com.eyelevel.lotprocessor.dto.job.response.JobResultView;
import com.eyelevel.lotprocessor.dto.job.response.JobStatusSnapshot;
import com.eyelevel.lotprocessor.exception.InvalidSignatureException;
import com.eyelevel.lotprocessor.exception.JobNotFoundException;
import com.eyelevel.lotprocessor.exception.JobStateConflictException;
import com.eyelevel.lotprocessor.exception.LotProcessingException;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.eyelevel.lotprocessor.service.job.BatchOrchestrationService;
import com.eyelevel.lotprocessor.service.job.LotSubmission;
import com.eyelevel.lotprocessor.service.signature.SignatureService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST controller for submitting lots and following the resulting batch jobs.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class BatchJobController implements BatchJobApi {

    static final String SUPPORTED_VERSION = "1.0.0";

    private final BatchOrchestrationService orchestrationService;
    private final SignatureService signatureService;
    private final JsonParser jsonParser;
    private final Validator validator;
    private final LotProcessingConfig config;

    public BatchJobController(final BatchOrchestrationService orchestrationService,
                              final SignatureService signatureService,
                              @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                              final Validator validator,
                              final LotProcessingConfig config) {
        this.orchestrationService = orchestrationService;
        this.signatureService = signatureService;
        this.jsonParser = jsonParser;
        this.validator = validator;
        this.config = config;
    }

    /**
     * The body is taken as a tree so the signature is checked against the lots exactly as the client sent them.
     */
    @Override
    @PostMapping("/generate-descriptions")
    public ResponseEntity<ApiResponse<CreateJobResponse>> generateDescriptions(@RequestBody final JsonNode body) {
        CreateJobRequest request = jsonParser.treeToValue(body, CreateJobRequest.class);
        Set<ConstraintViolation<CreateJobRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        if (!SUPPORTED_VERSION.equals(request.getVersion())) {
            throw new LotProcessingException("Unsupported version '" + request.getVersion() + "'. Expected "
                                             + SUPPORTED_VERSION + ".");
        }
        if (config.getSecurity().isRequireSignature()
            && !signatureService.verify(body.get("lots"), request.getSignature())) {
            log.warn("Rejected request for {} lot(s): invalid signature", request.getLots().size());
            throw new InvalidSignatureException("Invalid signature");
        }

        log.info("Received request for {} lot(s), languages {}", request.getLots().size(), request.getLanguages());
        UUID jobId = orchestrationService.createJob(toSubmissions(request.getLots()), request.getLanguages(),
                                                    request.getWebhookUrl());

        return new ResponseEntity<>(ApiResponse.success(CreateJobResponse.accepted(jobId),
                                                        "Job accepted for processing.", HttpStatus.CREATED.value()),
                                    HttpStatus.CREATED);
    }

    @Override
    @GetMapping("/jobs/{jobId}/status")
    public ResponseEntity<ApiResponse<JobStatusSnapshot>> getJobStatus(@PathVariable("jobId") final UUID jobId) {
        JobStatusSnapshot snapshot = orchestrationService.getStatus(jobId)
                                                         .orElseThrow(() -> new JobNotFoundException(jobId));
        return ResponseEntity.ok(ApiResponse.success(snapshot, "Job status retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobResultView>> getJobResults(@PathVariable("jobId") final UUID jobId) {
        JobResultView results = orchestrationService.getResults(jobId)
                                                    .orElseThrow(() -> new JobNotFoundException(jobId));
        return ResponseEntity.ok(ApiResponse.success(results, "Job results retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/jobs")
    public ResponseEntity<ApiResponse<Page<JobStatusSnapshot>>> listJobs(
            @RequestParam(value = "status", required = false) final JobStatus status,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "20") final int size) {
        Page<JobStatusSnapshot> jobs = orchestrationService.listJobs(status, page, size);
        return ResponseEntity.ok(ApiResponse.success(jobs, "Jobs retrieved successfully.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<ApiResponse<JobStatusSnapshot>> cancelJob(
            @PathVariable("jobId") final UUID jobId,
            @RequestParam(value = "reason", required = false) final String reason) {
        if (!orchestrationService.cancelJob(jobId, reason)) {
            throw new JobStateConflictException("Job " + jobId + " can no longer be cancelled");
        }
        JobStatusSnapshot snapshot = orchestrationService.getStatus(jobId)
                                                         .orElseThrow(() -> new JobNotFoundException(jobId));
        return ResponseEntity.ok(ApiResponse.success(snapshot, "Job cancelled successfully.", HttpStatus.OK.value()));
    }

    private static List<LotSubmission> toSubmissions(final List<CreateJobRequest.LotRequest> lots) {
        return lots.stream()
                   .map(lot -> new LotSubmission(lot.getLotId(), lot.getAdditionalInfo(),
                                                 lot.getImages() == null ? List.of()
                                                                         : lot.getImages().stream()
                                                                              .filter(image -> image != null)
                                                                              .map(CreateJobRequest.ImageRequest::getUrl)
                                                                              .toList(),
                                                 lot.getWebhookUrl()))
                   .toList();
    }
}
