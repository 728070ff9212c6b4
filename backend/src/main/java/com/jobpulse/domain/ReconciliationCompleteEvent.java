package com.jobpulse.domain;

/**
 * Application event: a tracking handle left PENDING. status is SUCCEEDED or FAILED.
 */
public record ReconciliationCompleteEvent(String handleId, String jobId, TrackingHandle.HandleState status) {
}
