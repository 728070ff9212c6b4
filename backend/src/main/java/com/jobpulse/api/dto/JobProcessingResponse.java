package com.jobpulse.api.dto;

/**
 * Placeholder returned while a job's start or end has not been reconciled yet.
 */
public record JobProcessingResponse(String jobId, String status) {

    public static JobProcessingResponse of(String jobId) {
        return new JobProcessingResponse(jobId, "processing");
    }
}
