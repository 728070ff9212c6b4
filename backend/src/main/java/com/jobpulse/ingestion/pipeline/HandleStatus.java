package com.jobpulse.ingestion.pipeline;

import com.jobpulse.domain.TrackingHandle;

/**
 * Snapshot of a tracking handle for polling clients.
 */
public record HandleStatus(String handleId,
                           TrackingHandle.HandleState state,
                           String jobId,
                           String failureReason,
                           String failureMessage) {

    public static HandleStatus of(TrackingHandle handle) {
        return new HandleStatus(
                handle.getId(),
                handle.getStatus(),
                handle.getJobId(),
                handle.getFailureReason(),
                handle.getFailureMessage());
    }

    public boolean isPending() {
        return state == TrackingHandle.HandleState.PENDING;
    }
}
