package com.jobpulse.ingestion.reconcile;

public enum MergeEffect {
    /** State moved forward. */
    CHANGED,
    /** Event already reflected, or carried a later value than the stored one. */
    UNCHANGED,
    /** Same event seen before (ledger hit or identical task row). */
    DUPLICATE,
    /** Conflict resolved by processing order; recorded on the job. */
    ANOMALY
}
