package com.jobpulse.ingestion.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Boundary between event submission and asynchronous reconciliation.
 */
public interface ExecutionBoundary {

    /**
     * Accepts one envelope and returns its tracking handle id immediately. Reconciliation runs off the caller's thread.
     * An envelope the classifier rejects still gets a handle, already FAILED with the error kind as reason.
     */
    String submit(JsonNode envelope);

    /**
     * @return empty when the handle is unknown
     */
    Optional<HandleStatus> poll(String handleId);
}
