package com.jobpulse.ingestion.event;

import java.time.Instant;

/**
 * Task completion. durationMs is validated by the reconciler, not here: a negative value still classifies.
 */
public record TaskEndEvent(String jobId, Instant timestamp, String taskId, long durationMs, boolean successful)
        implements LifecycleEvent {

    @Override
    public EventKind kind() {
        return EventKind.TASK_END;
    }
}
