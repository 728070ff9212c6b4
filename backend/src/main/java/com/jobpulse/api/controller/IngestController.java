package com.jobpulse.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobpulse.api.dto.ErrorBody;
import com.jobpulse.api.dto.IngestAcceptedResponse;
import com.jobpulse.ingestion.pipeline.ExecutionBoundary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /ingest: accepts one lifecycle event envelope and returns its tracking handle.
 * Only the envelope shape is checked here; field-level problems surface on the handle.
 */
@RestController
@RequestMapping("/api/v1/ingest")
@RequiredArgsConstructor
public class IngestController {

    private final ExecutionBoundary executionBoundary;

    @PostMapping
    public ResponseEntity<?> ingest(@RequestBody JsonNode envelope) {
        if (envelope == null || !envelope.isObject()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ENVELOPE", "Event envelope must be a JSON object"));
        }
        JsonNode event = envelope.get("event");
        if (event == null || !event.isTextual() || event.asText().isBlank()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ENVELOPE", "Field 'event' is required"));
        }
        JsonNode jobId = envelope.get("job_id");
        if (jobId == null || jobId.isNull() || jobId.asText().isBlank()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ENVELOPE", "Field 'job_id' is required"));
        }
        String handleId = executionBoundary.submit(envelope);
        return ResponseEntity.accepted().body(IngestAcceptedResponse.received(handleId));
    }
}
