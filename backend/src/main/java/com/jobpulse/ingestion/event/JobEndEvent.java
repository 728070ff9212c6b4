package com.jobpulse.ingestion.event;

import com.jobpulse.domain.JobResult;

import java.time.Instant;

/**
 * timestamp is the completion time (completion_time, else timestamp). result is SUCCEEDED or FAILED.
 */
public record JobEndEvent(String jobId, Instant timestamp, JobResult result) implements LifecycleEvent {

    @Override
    public EventKind kind() {
        return EventKind.JOB_END;
    }
}
