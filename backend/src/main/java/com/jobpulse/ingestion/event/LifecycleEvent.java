package com.jobpulse.ingestion.event;

import java.time.Instant;

/**
 * Typed lifecycle event. Instances are built only by EventClassifier; downstream code never sees raw payloads.
 */
public interface LifecycleEvent {

    EventKind kind();

    String jobId();

    /** Wall-clock time carried by the event; the tie-break for conflicting values. */
    Instant timestamp();
}
