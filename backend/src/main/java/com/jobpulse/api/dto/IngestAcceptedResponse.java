package com.jobpulse.api.dto;

/**
 * POST /ingest response; taskId is the tracking handle.
 */
public record IngestAcceptedResponse(String status, String taskId) {

    public static IngestAcceptedResponse received(String taskId) {
        return new IngestAcceptedResponse("received", taskId);
    }
}
