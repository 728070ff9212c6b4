package com.jobpulse.domain;

/**
 * Application event: a tracking handle is ready for reconciliation. Published on submission and by the pending
 * redelivery sweep; consumed by ReconciliationWorker.
 */
public record EventSubmittedEvent(String handleId) {
}
