package com.eyelevel.lotprocessor.controller;

import com.eyelevel.lotprocessor.dto.common.ApiResponse;
import com.eyelevel.lotprocessor.dto.job.request.CreateJobRequest;
import com.eyelevel.lotprocessor.dto.job.response.CreateJobResponse;
import com.eyelevel.lotprocessor.dto.job.response.JobResultView;
import com.eyelevel.lotprocessor.dto.job.response.JobStatusSnapshot;
import com.eyelevel.lotprocessor.model.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.UUID;

@Tag(name = "Batch Jobs", description = "Submit lots for description generation and follow the resulting jobs.")
public interface BatchJobApi {

    @Operation(summary = "Generate Descriptions",
            description = "Creates a job for the given lots and submits vision inference. Returns immediately; results are delivered to the webhook URL(s) once the job completes.")
    @io.swagger.v3.oas.annotations.parameters.RequestBody(required = true,
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = CreateJobRequest.class)))
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Job accepted.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Job accepted for processing.",
                                        "response": {
                                            "job_id": "6f1c2a4e-9a53-4d0f-8d59-3f3b8f1f2c10",
                                            "status": "accepted"
                                        },
                                        "showMessage": true,
                                        "statusCode": 201
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "Invalid signature.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<CreateJobResponse>> generateDescriptions(@RequestBody JsonNode body);

    @Operation(summary = "Get Job Status", description = "Returns the job's counters and progress. Never contacts the inference provider.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status found."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusSnapshot>> getJobStatus(
            @Parameter(description = "The job id returned on submission.", required = true) @PathVariable("jobId") UUID jobId);

    @Operation(summary = "Get Job Results", description = "Returns the job status together with every lot's description, translations and errors.")
    ResponseEntity<ApiResponse<JobResultView>> getJobResults(
            @Parameter(description = "The job id returned on submission.", required = true) @PathVariable("jobId") UUID jobId);

    @Operation(summary = "List Jobs", description = "Pages through jobs, newest first, optionally filtered by status.")
    ResponseEntity<ApiResponse<Page<JobStatusSnapshot>>> listJobs(
            @Parameter(description = "Only jobs with this status.") @RequestParam(value = "status", required = false) JobStatus status,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") int page,
            @Parameter(description = "Page size, at most 100.") @RequestParam(value = "size", defaultValue = "20") int size);

    @Operation(summary = "Cancel Job", description = "Stops local processing of a pending, processing or translating job. The remote batch is not cancelled.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job cancelled."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown job.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Job can no longer be cancelled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusSnapshot>> cancelJob(
            @Parameter(description = "The job id returned on submission.", required = true) @PathVariable("jobId") UUID jobId,
            @Parameter(description = "Reason recorded on the job.") @RequestParam(value = "reason", required = false) String reason);
}
