package com.jobpulse.domain;

import java.time.Instant;

/**
 * Embedded in {@link JobRecord}: a conflict the merge resolved deterministically instead of by timestamp.
 * field is e.g. "user", "result" or "task:&lt;taskId&gt;".
 */
public record MergeAnomaly(String field, String keptValue, String rejectedValue, Instant detectedAt) {
}
