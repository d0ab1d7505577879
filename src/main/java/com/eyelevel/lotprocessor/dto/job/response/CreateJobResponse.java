package com.eyelevel.lotprocessor.dto.job.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * @param jobId  The id to poll status with.
 * @param status Always "accepted": inference runs asynchronously.
 */
public record CreateJobResponse(@JsonProperty("job_id") UUID jobId, String status) {

    public static CreateJobResponse accepted(UUID jobId) {
        return new CreateJobResponse(jobId, "accepted");
    }
}
