package com.jobpulse.ingestion.reconcile;

import com.jobpulse.ingestion.event.EventKind;

public record ReconcileResult(String jobId, EventKind kind, MergeEffect effect) {
}
