package com.jobpulse.ingestion.event;

import java.time.Instant;

public record JobStartEvent(String jobId, Instant timestamp, String user) implements LifecycleEvent {

    @Override
    public EventKind kind() {
        return EventKind.JOB_START;
    }
}
