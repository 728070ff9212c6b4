package com.jobpulse.domain;

/**
 * Conditional updates on tracking_handles that derived queries cannot express.
 */
public interface TrackingHandleRepositoryCustom {

    /**
     * Moves the handle out of PENDING. Returns false when it was already completed (by another worker or a
     * redelivered dispatch), in which case nothing is written.
     */
    boolean completeIfPending(String handleId, TrackingHandle.HandleState status, String failureReason, String failureMessage);

    /** Increments dispatchCount and stamps lastDispatchedAt; no-op unless still PENDING. */
    boolean markDispatched(String handleId);
}
