package com.jobpulse.ingestion.event;

/**
 * Classifier output: the typed event and its deterministic idempotency key.
 */
public record ClassifiedEvent(LifecycleEvent event, String idempotencyKey) {

    public String jobId() {
        return event.jobId();
    }

    public EventKind kind() {
        return event.kind();
    }
}
