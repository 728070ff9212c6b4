package com.jobpulse.ingestion.store;

import com.jobpulse.domain.TaskOutcome;

/**
 * Result of {@link TaskLedger#record}. stored is the row that survives (new or pre-existing).
 */
public record TaskRecordOutcome(Kind kind, TaskOutcome stored) {

    public enum Kind {
        /** First delivery; row inserted. */
        RECORDED,
        /** Row exists with identical content. */
        DUPLICATE,
        /** Row exists with different content; the first-applied content was kept. */
        CONFLICT
    }
}
